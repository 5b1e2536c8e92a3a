package com.impact.apidiff.util;

import com.impact.apidiff.api.model.ClassDescriptor;
import com.impact.apidiff.api.model.FunctionSignature;

import java.util.ArrayList;
import java.util.List;

/**
 * Renders signatures for change records, e.g. {@code connect(host: str, port = 22, *args, **kwargs) -> Session}.
 */
public final class SignatureFormatter {

    private SignatureFormatter() {}

    public static String format(FunctionSignature signature) {
        List<String> rendered = new ArrayList<>();
        for (String parameter : signature.getParameters()) {
            StringBuilder part = new StringBuilder(parameter);
            String annotation = signature.annotationFor(parameter);
            if (annotation != null) {
                part.append(": ").append(annotation);
            }
            if (signature.hasDefault(parameter)) {
                part.append(" = ").append(signature.defaultFor(parameter));
            }
            rendered.add(part.toString());
        }
        if (signature.getVararg() != null) {
            rendered.add("*" + signature.getVararg());
        }
        if (signature.getKwarg() != null) {
            rendered.add("**" + signature.getKwarg());
        }

        StringBuilder text = new StringBuilder(signature.getName())
                .append('(')
                .append(String.join(", ", rendered))
                .append(')');
        if (signature.getReturnAnnotation() != null) {
            text.append(" -> ").append(signature.getReturnAnnotation());
        }
        return text.toString();
    }

    public static String format(ClassDescriptor descriptor) {
        return "class " + descriptor.getName() + "(" + String.join(", ", descriptor.getBases()) + ")";
    }
}
