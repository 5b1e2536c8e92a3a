package com.impact.apidiff.analyzer;

import com.impact.apidiff.api.model.ChangeKind;
import com.impact.apidiff.api.model.ChangeRecord;
import com.impact.apidiff.api.model.ClassDescriptor;
import com.impact.apidiff.api.model.FunctionSignature;
import com.impact.apidiff.api.model.Severity;
import com.impact.apidiff.api.model.StructuralModel;
import com.impact.apidiff.util.SignatureFormatter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Compares the old and new structural model of one file and reports breaking changes.
 * <p>
 * Checks run in a fixed order and their outputs are concatenated: removed functions, function signature
 * changes, removed classes, class/method changes, import changes. A file missing on one side arrives as an
 * empty model, so "everything removed" needs no special case.
 */
@Slf4j
@Component
public class SignatureDiffer {

    public List<ChangeRecord> diff(StructuralModel oldModel, StructuralModel newModel, String filePath) {
        List<ChangeRecord> changes = new ArrayList<>();

        changes.addAll(checkRemovedFunctions(oldModel, newModel, filePath));
        changes.addAll(checkFunctionSignatureChanges(oldModel, newModel, filePath));
        changes.addAll(checkRemovedClasses(oldModel, newModel, filePath));
        changes.addAll(checkClassMethodChanges(oldModel, newModel, filePath));
        changes.addAll(checkImportChanges(oldModel, newModel, filePath));

        log.debug("Found {} breaking change(s) in {}", changes.size(), filePath);
        return changes;
    }

    private List<ChangeRecord> checkRemovedFunctions(StructuralModel oldModel, StructuralModel newModel, String filePath) {
        List<ChangeRecord> changes = new ArrayList<>();
        for (FunctionSignature function : oldModel.getFunctions().values()) {
            if (!newModel.getFunctions().containsKey(function.getName())) {
                changes.add(ChangeRecord.builder()
                        .kind(ChangeKind.FUNCTION_REMOVED)
                        .filePath(filePath)
                        .line(function.getLine())
                        .elementName(function.getName())
                        .oldSignature(SignatureFormatter.format(function))
                        .newSignature(ChangeRecord.REMOVED_SIGNATURE)
                        .description("Function '" + function.getName() + "' was removed")
                        .severity(Severity.HIGH)
                        .build());
                log.debug("Found FUNCTION_REMOVED: {}", function.getName());
            }
        }
        return changes;
    }

    private List<ChangeRecord> checkFunctionSignatureChanges(StructuralModel oldModel, StructuralModel newModel, String filePath) {
        List<ChangeRecord> changes = new ArrayList<>();
        for (FunctionSignature oldFunction : oldModel.getFunctions().values()) {
            FunctionSignature newFunction = newModel.getFunctions().get(oldFunction.getName());
            if (newFunction == null) {
                continue;
            }
            for (SignatureChange change : compareSignatures(oldFunction, newFunction)) {
                changes.add(toRecord(change, filePath, oldFunction.getName(), oldFunction, newFunction, change.description));
            }
        }
        return changes;
    }

    private List<ChangeRecord> checkRemovedClasses(StructuralModel oldModel, StructuralModel newModel, String filePath) {
        List<ChangeRecord> changes = new ArrayList<>();
        for (ClassDescriptor descriptor : oldModel.getClasses().values()) {
            if (!newModel.getClasses().containsKey(descriptor.getName())) {
                changes.add(ChangeRecord.builder()
                        .kind(ChangeKind.CLASS_REMOVED)
                        .filePath(filePath)
                        .line(descriptor.getLine())
                        .elementName(descriptor.getName())
                        .oldSignature(SignatureFormatter.format(descriptor))
                        .newSignature(ChangeRecord.REMOVED_SIGNATURE)
                        .description("Class '" + descriptor.getName() + "' was removed")
                        .severity(Severity.HIGH)
                        .build());
                log.debug("Found CLASS_REMOVED: {}", descriptor.getName());
            }
        }
        return changes;
    }

    private List<ChangeRecord> checkClassMethodChanges(StructuralModel oldModel, StructuralModel newModel, String filePath) {
        List<ChangeRecord> changes = new ArrayList<>();
        for (ClassDescriptor oldClass : oldModel.getClasses().values()) {
            ClassDescriptor newClass = newModel.getClasses().get(oldClass.getName());
            if (newClass == null) {
                continue;
            }
            String className = oldClass.getName();
            Map<String, FunctionSignature> newMethods = newClass.getMethods();

            for (FunctionSignature oldMethod : oldClass.getMethods().values()) {
                if (!newMethods.containsKey(oldMethod.getName())) {
                    changes.add(ChangeRecord.builder()
                            .kind(ChangeKind.METHOD_REMOVED)
                            .filePath(filePath)
                            .line(oldMethod.getLine())
                            .elementName(oldMethod.qualifiedName())
                            .oldSignature(SignatureFormatter.format(oldMethod))
                            .newSignature(ChangeRecord.REMOVED_SIGNATURE)
                            .description("Method '" + oldMethod.getName() + "' was removed from class '" + className + "'")
                            .severity(Severity.HIGH)
                            .build());
                    log.debug("Found METHOD_REMOVED: {}.{}", className, oldMethod.getName());
                }
            }

            for (FunctionSignature oldMethod : oldClass.getMethods().values()) {
                FunctionSignature newMethod = newMethods.get(oldMethod.getName());
                if (newMethod == null) {
                    continue;
                }
                String prefix = "Method '" + oldMethod.getName() + "' in class '" + className + "': ";
                for (SignatureChange change : compareSignatures(oldMethod, newMethod)) {
                    changes.add(toRecord(change, filePath, oldMethod.qualifiedName(),
                            oldMethod, newMethod, prefix + change.description));
                }
            }
        }
        return changes;
    }

    /**
     * Reserved for public re-export path detection; import edits inside a module are not breaking on their own.
     */
    private List<ChangeRecord> checkImportChanges(StructuralModel oldModel, StructuralModel newModel, String filePath) {
        return List.of();
    }

    /**
     * Pairwise comparison of two revisions of the same callable. Only parameters present on both sides are
     * compared for default and annotation changes; newly added parameters are not reported.
     */
    List<SignatureChange> compareSignatures(FunctionSignature oldSig, FunctionSignature newSig) {
        List<SignatureChange> changes = new ArrayList<>();
        List<String> oldParams = oldSig.getParameters();
        List<String> newParams = newSig.getParameters();
        Set<String> newParamSet = new HashSet<>(newParams);

        for (String parameter : oldParams) {
            if (!newParamSet.contains(parameter)) {
                changes.add(new SignatureChange(ChangeKind.PARAMETER_REMOVED, Severity.HIGH,
                        "Parameter '" + parameter + "' was removed"));
            }
        }

        Set<String> oldParamSet = new HashSet<>(oldParams);
        List<String> oldOrder = oldParams.stream().filter(newParamSet::contains).collect(Collectors.toList());
        List<String> newOrder = newParams.stream().filter(oldParamSet::contains).collect(Collectors.toList());
        if (!oldOrder.equals(newOrder)) {
            changes.add(new SignatureChange(ChangeKind.SIGNATURE_REORDERED, Severity.HIGH,
                    "Parameter order changed from (" + String.join(", ", oldOrder)
                            + ") to (" + String.join(", ", newOrder) + ")"));
        }

        for (String parameter : oldOrder) {
            boolean hadDefault = oldSig.hasDefault(parameter);
            boolean hasDefault = newSig.hasDefault(parameter);
            if (hadDefault && !hasDefault) {
                changes.add(new SignatureChange(ChangeKind.PARAMETER_BECAME_REQUIRED, Severity.HIGH,
                        "Parameter '" + parameter + "' became required (default value removed)"));
            } else if (!hadDefault && hasDefault) {
                changes.add(new SignatureChange(ChangeKind.PARAMETER_BECAME_OPTIONAL, Severity.LOW,
                        "Parameter '" + parameter + "' became optional (default value added)"));
            } else if (hadDefault && !oldSig.defaultFor(parameter).equals(newSig.defaultFor(parameter))) {
                changes.add(new SignatureChange(ChangeKind.DEFAULT_VALUE_CHANGED, Severity.MEDIUM,
                        "Default value for parameter '" + parameter + "' changed from '"
                                + oldSig.defaultFor(parameter) + "' to '" + newSig.defaultFor(parameter) + "'"));
            }
        }

        String oldReturn = oldSig.getReturnAnnotation();
        String newReturn = newSig.getReturnAnnotation();
        if (!Objects.equals(oldReturn, newReturn)) {
            if (oldReturn != null && newReturn != null) {
                changes.add(new SignatureChange(ChangeKind.RETURN_TYPE_CHANGED, Severity.MEDIUM,
                        "Return type annotation changed from '" + oldReturn + "' to '" + newReturn + "'"));
            } else if (oldReturn != null) {
                changes.add(new SignatureChange(ChangeKind.RETURN_TYPE_REMOVED, Severity.LOW,
                        "Return type annotation removed"));
            } else {
                changes.add(new SignatureChange(ChangeKind.RETURN_TYPE_ADDED, Severity.LOW,
                        "Return type annotation added: '" + newReturn + "'"));
            }
        }

        for (String parameter : oldOrder) {
            String oldAnnotation = oldSig.annotationFor(parameter);
            String newAnnotation = newSig.annotationFor(parameter);
            if (Objects.equals(oldAnnotation, newAnnotation)) {
                continue;
            }
            if (oldAnnotation != null && newAnnotation != null) {
                changes.add(new SignatureChange(ChangeKind.PARAM_ANNOTATION_CHANGED, Severity.MEDIUM,
                        "Type annotation for parameter '" + parameter + "' changed from '"
                                + oldAnnotation + "' to '" + newAnnotation + "'"));
            } else if (oldAnnotation != null) {
                changes.add(new SignatureChange(ChangeKind.PARAM_ANNOTATION_REMOVED, Severity.LOW,
                        "Type annotation for parameter '" + parameter + "' removed"));
            } else {
                changes.add(new SignatureChange(ChangeKind.PARAM_ANNOTATION_ADDED, Severity.LOW,
                        "Type annotation for parameter '" + parameter + "' added: '" + newAnnotation + "'"));
            }
        }

        return changes;
    }

    private ChangeRecord toRecord(SignatureChange change,
                                  String filePath,
                                  String elementName,
                                  FunctionSignature oldSig,
                                  FunctionSignature newSig,
                                  String description) {
        log.debug("Found {}: {}", change.kind, elementName);
        return ChangeRecord.builder()
                .kind(change.kind)
                .filePath(filePath)
                .line(newSig.getLine())
                .elementName(elementName)
                .oldSignature(SignatureFormatter.format(oldSig))
                .newSignature(SignatureFormatter.format(newSig))
                .description(description)
                .severity(change.severity)
                .build();
    }

    static final class SignatureChange {
        final ChangeKind kind;
        final Severity severity;
        final String description;

        SignatureChange(ChangeKind kind, Severity severity, String description) {
            this.kind = kind;
            this.severity = severity;
            this.description = description;
        }
    }
}
