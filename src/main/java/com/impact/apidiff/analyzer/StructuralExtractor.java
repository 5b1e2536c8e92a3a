package com.impact.apidiff.analyzer;

import com.impact.apidiff.api.model.ClassDescriptor;
import com.impact.apidiff.api.model.FunctionSignature;
import com.impact.apidiff.api.model.ImportDescriptor;
import com.impact.apidiff.api.model.StructuralModel;
import com.impact.apidiff.exception.SourceParseException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.treesitter.TSNode;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static com.impact.apidiff.analyzer.ParsedSource.field;
import static com.impact.apidiff.analyzer.ParsedSource.line;
import static com.impact.apidiff.analyzer.ParsedSource.namedChildren;
import static com.impact.apidiff.analyzer.ParsedSource.sameNode;

/**
 * Extracts the public surface of one revision of a Python file: module-level functions, module-level
 * classes with the methods declared directly in their body, imports and module-level variable names.
 * Deeper nesting is intentionally not modeled.
 */
@Slf4j
@Component
public class StructuralExtractor {

    private final PythonSyntaxParser parser;

    public StructuralExtractor(PythonSyntaxParser parser) {
        this.parser = parser;
    }

    /**
     * Builds the structural model of {@code sourceText}.
     *
     * @throws SourceParseException when the text is not valid Python
     */
    public StructuralModel extract(String sourceText, String filePath) throws SourceParseException {
        if (sourceText == null || sourceText.isBlank()) {
            return StructuralModel.empty();
        }
        ParsedSource parsed = parser.parse(sourceText, filePath);
        return buildModel(parsed);
    }

    /**
     * Like {@link #extract} but reports a parse failure as an empty optional, logged at WARN.
     */
    public Optional<StructuralModel> tryExtract(String sourceText, String filePath) {
        try {
            return Optional.of(extract(sourceText, filePath));
        } catch (SourceParseException e) {
            log.warn("Model unavailable for {}: {}", filePath, e.getMessage());
            return Optional.empty();
        }
    }

    private StructuralModel buildModel(ParsedSource parsed) {
        Map<String, FunctionSignature> functions = new LinkedHashMap<>();
        Map<String, ClassDescriptor> classes = new LinkedHashMap<>();
        Map<String, ImportDescriptor> imports = new LinkedHashMap<>();
        Set<String> variables = new LinkedHashSet<>();

        for (TSNode statement : namedChildren(parsed.root())) {
            switch (statement.getType()) {
                case "function_definition":
                case "class_definition":
                case "decorated_definition":
                    collectDefinition(parsed, statement, functions, classes);
                    break;
                case "import_statement":
                case "import_from_statement":
                case "future_import_statement":
                    ImportDescriptor descriptor = extractImport(parsed, statement);
                    descriptor.getImportedNames().forEach(name -> imports.put(name, descriptor));
                    break;
                case "expression_statement":
                    collectAssignmentTargets(parsed, statement, variables);
                    break;
                default:
                    // Control flow, comments and bare expressions are not part of the public surface
                    break;
            }
        }

        log.trace("Extracted {} functions, {} classes, {} imports", functions.size(), classes.size(), imports.size());
        return StructuralModel.builder()
                .functions(functions)
                .classes(classes)
                .imports(imports)
                .moduleLevelVariableNames(variables)
                .build();
    }

    private void collectDefinition(ParsedSource parsed,
                                   TSNode node,
                                   Map<String, FunctionSignature> functions,
                                   Map<String, ClassDescriptor> classes) {
        List<String> decorators = new ArrayList<>();
        TSNode definition = unwrapDecorated(parsed, node, decorators);
        if (definition == null) {
            return;
        }
        if ("function_definition".equals(definition.getType())) {
            FunctionSignature function = extractFunction(parsed, definition, decorators, null);
            functions.put(function.getName(), function);
        } else if ("class_definition".equals(definition.getType())) {
            ClassDescriptor descriptor = extractClass(parsed, definition, decorators);
            classes.put(descriptor.getName(), descriptor);
        }
    }

    /**
     * Returns the function or class node behind an optional {@code decorated_definition},
     * collecting decorator expression texts in declared order.
     */
    private TSNode unwrapDecorated(ParsedSource parsed, TSNode node, List<String> decorators) {
        if (!"decorated_definition".equals(node.getType())) {
            return node;
        }
        for (TSNode child : namedChildren(node)) {
            if ("decorator".equals(child.getType())) {
                decorators.add(decoratorText(parsed, child));
            }
        }
        return field(node, "definition");
    }

    private String decoratorText(ParsedSource parsed, TSNode decorator) {
        for (TSNode child : namedChildren(decorator)) {
            if (!"comment".equals(child.getType())) {
                return parsed.text(child);
            }
        }
        String raw = parsed.text(decorator).strip();
        return raw.startsWith("@") ? raw.substring(1).strip() : raw;
    }

    private ClassDescriptor extractClass(ParsedSource parsed, TSNode classNode, List<String> decorators) {
        String className = parsed.text(field(classNode, "name"));

        List<String> bases = new ArrayList<>();
        TSNode superclasses = field(classNode, "superclasses");
        if (superclasses != null) {
            for (TSNode base : namedChildren(superclasses)) {
                // metaclass=... and other keywords are not bases
                if (!"keyword_argument".equals(base.getType()) && !"comment".equals(base.getType())) {
                    bases.add(parsed.text(base));
                }
            }
        }

        Map<String, FunctionSignature> methods = new LinkedHashMap<>();
        TSNode body = field(classNode, "body");
        if (body != null) {
            for (TSNode member : namedChildren(body)) {
                if (!"function_definition".equals(member.getType()) && !"decorated_definition".equals(member.getType())) {
                    continue;
                }
                List<String> methodDecorators = new ArrayList<>();
                TSNode definition = unwrapDecorated(parsed, member, methodDecorators);
                if (definition != null && "function_definition".equals(definition.getType())) {
                    FunctionSignature method = extractFunction(parsed, definition, methodDecorators, className);
                    // Later declarations shadow earlier ones, as in normal class scoping
                    methods.put(method.getName(), method);
                }
            }
        }

        return ClassDescriptor.builder()
                .name(className)
                .bases(bases)
                .decorators(decorators)
                .line(line(classNode))
                .methods(methods)
                .build();
    }

    private FunctionSignature extractFunction(ParsedSource parsed,
                                              TSNode functionNode,
                                              List<String> decorators,
                                              String owningClass) {
        FunctionSignature.FunctionSignatureBuilder builder = FunctionSignature.builder()
                .name(parsed.text(field(functionNode, "name")))
                .decorators(decorators)
                .method(owningClass != null)
                .owningClass(owningClass)
                .line(line(functionNode))
                .async(functionNode.getChildCount() > 0 && "async".equals(functionNode.getChild(0).getType()));

        TSNode returnType = field(functionNode, "return_type");
        if (returnType != null) {
            builder.returnAnnotation(parsed.text(returnType));
        }

        TSNode parametersNode = field(functionNode, "parameters");
        if (parametersNode != null) {
            new ParameterCollector(parsed).collect(parametersNode, builder);
        }
        return builder.build();
    }

    private ImportDescriptor extractImport(ParsedSource parsed, TSNode statement) {
        List<String> names = new ArrayList<>();
        Map<String, String> aliases = new LinkedHashMap<>();
        String module = "";
        boolean fromImport = !"import_statement".equals(statement.getType());

        TSNode moduleNode = null;
        if ("import_from_statement".equals(statement.getType())) {
            moduleNode = field(statement, "module_name");
            module = parsed.text(moduleNode);
        } else if ("future_import_statement".equals(statement.getType())) {
            module = "__future__";
        }

        for (TSNode child : namedChildren(statement)) {
            if (sameNode(child, moduleNode)) {
                continue;
            }
            switch (child.getType()) {
                case "dotted_name":
                    names.add(parsed.text(child));
                    break;
                case "aliased_import":
                    String original = parsed.text(field(child, "name"));
                    names.add(original);
                    aliases.put(original, parsed.text(field(child, "alias")));
                    break;
                case "wildcard_import":
                    names.add(ImportDescriptor.WILDCARD);
                    break;
                default:
                    break;
            }
        }

        return ImportDescriptor.builder()
                .module(module)
                .importedNames(names)
                .aliases(aliases)
                .fromImport(fromImport)
                .line(line(statement))
                .build();
    }

    private void collectAssignmentTargets(ParsedSource parsed, TSNode statement, Set<String> variables) {
        for (TSNode child : namedChildren(statement)) {
            TSNode assignment = child;
            // x = y = 1 nests the second assignment in the right-hand side
            while (assignment != null && "assignment".equals(assignment.getType())) {
                collectTargetNames(parsed, field(assignment, "left"), variables);
                assignment = field(assignment, "right");
            }
        }
    }

    private void collectTargetNames(ParsedSource parsed, TSNode target, Set<String> variables) {
        if (target == null) {
            return;
        }
        switch (target.getType()) {
            case "identifier":
                variables.add(parsed.text(target));
                break;
            case "pattern_list":
            case "tuple_pattern":
            case "list_pattern":
            case "list_splat_pattern":
                for (TSNode element : namedChildren(target)) {
                    collectTargetNames(parsed, element, variables);
                }
                break;
            default:
                // Attribute and subscript targets do not bind module-level names
                break;
        }
    }

    /**
     * Walks a {@code parameters} node. Parameters after a bare {@code *} or {@code *args} are keyword-only
     * and are left out of the positional list.
     */
    private static final class ParameterCollector {

        private final ParsedSource parsed;
        private final List<String> positional = new ArrayList<>();
        private final Map<String, String> defaults = new LinkedHashMap<>();
        private final Map<String, String> annotations = new LinkedHashMap<>();
        private String vararg;
        private String kwarg;
        private boolean keywordOnly;

        ParameterCollector(ParsedSource parsed) {
            this.parsed = parsed;
        }

        void collect(TSNode parametersNode, FunctionSignature.FunctionSignatureBuilder builder) {
            for (TSNode parameter : namedChildren(parametersNode)) {
                switch (parameter.getType()) {
                    case "identifier":
                        addPositional(parsed.text(parameter), null, null);
                        break;
                    case "default_parameter":
                        addPositional(parsed.text(field(parameter, "name")), null,
                                parsed.text(field(parameter, "value")));
                        break;
                    case "typed_default_parameter":
                        addPositional(parsed.text(field(parameter, "name")),
                                parsed.text(field(parameter, "type")),
                                parsed.text(field(parameter, "value")));
                        break;
                    case "typed_parameter":
                        collectTyped(parameter);
                        break;
                    case "list_splat_pattern":
                        vararg = splatName(parameter);
                        keywordOnly = true;
                        break;
                    case "dictionary_splat_pattern":
                        kwarg = splatName(parameter);
                        break;
                    case "keyword_separator":
                        keywordOnly = true;
                        break;
                    default:
                        // positional_separator, comments
                        break;
                }
            }
            builder.parameters(positional)
                    .defaults(defaults)
                    .annotations(annotations)
                    .vararg(vararg)
                    .kwarg(kwarg);
        }

        private void collectTyped(TSNode parameter) {
            String type = parsed.text(field(parameter, "type"));
            List<TSNode> children = namedChildren(parameter);
            if (children.isEmpty()) {
                return;
            }
            TSNode target = children.get(0);
            switch (target.getType()) {
                case "list_splat_pattern":
                    vararg = splatName(target);
                    annotations.put(vararg, type);
                    keywordOnly = true;
                    break;
                case "dictionary_splat_pattern":
                    kwarg = splatName(target);
                    annotations.put(kwarg, type);
                    break;
                default:
                    addPositional(parsed.text(target), type, null);
                    break;
            }
        }

        private void addPositional(String name, String annotation, String defaultText) {
            if (keywordOnly || name.isEmpty()) {
                return;
            }
            positional.add(name);
            if (annotation != null && !annotation.isEmpty()) {
                annotations.put(name, annotation);
            }
            if (defaultText != null) {
                defaults.put(name, defaultText);
            }
        }

        private String splatName(TSNode splat) {
            for (TSNode child : namedChildren(splat)) {
                if ("identifier".equals(child.getType())) {
                    return parsed.text(child);
                }
            }
            String raw = parsed.text(splat);
            return raw.replace("*", "").strip();
        }
    }
}
