package io.fullerstack.rosdiscover.launch;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import io.fullerstack.rosdiscover.config.HierarchicalConfig;
import io.fullerstack.rosdiscover.io.FileSystem;
import io.fullerstack.rosdiscover.io.Shell;
import io.fullerstack.rosdiscover.parameter.ParameterValue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import java.io.IOException;
import java.io.StringReader;
import java.util.*;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads roslaunch XML files.
 * <p>
 * <b>Supported elements:</b> {@code launch}, {@code group}, {@code arg}, {@code node},
 * {@code remap}, {@code param}, {@code rosparam} and {@code include}, each honoring the
 * {@code if}/{@code unless} attributes. Other elements (e.g. {@code machine}, {@code env},
 * {@code test}) are skipped.
 * <p>
 * <b>Supported substitutions:</b> {@code $(arg name)} and {@code $(find pkg)}; the latter is
 * answered by running {@code rospack find} through the {@link Shell}.
 * <p>
 * Parameter names are qualified against the enclosing namespace. Parameters declared inside a
 * {@code node} element are private to that node and are qualified under its full name.
 */
public final class XmlLaunchFileReader implements LaunchFileReader {

    private static final Logger logger = LoggerFactory.getLogger(XmlLaunchFileReader.class);

    private static final Pattern SUBSTITUTION = Pattern.compile("\\$\\((\\w+)(?:\\s+([^)]*))?\\)");

    private final FileSystem files;
    private final Shell shell;
    private final String rospackCommand;
    private final ObjectMapper yaml = new ObjectMapper(new YAMLFactory());

    public XmlLaunchFileReader(FileSystem files, Shell shell, String rospackCommand) {
        this.files = Objects.requireNonNull(files, "files cannot be null");
        this.shell = Objects.requireNonNull(shell, "shell cannot be null");
        this.rospackCommand = Objects.requireNonNull(rospackCommand, "rospackCommand cannot be null");
    }

    public XmlLaunchFileReader(FileSystem files, Shell shell, HierarchicalConfig config) {
        this(files, shell, config.getString("launch.rospack-command"));
    }

    @Override
    public LaunchConfig read(String file, Map<String, String> arguments) {
        Objects.requireNonNull(file, "file cannot be null");
        Objects.requireNonNull(arguments, "arguments cannot be null");
        logger.debug("reading launch file: {}", file);

        Map<String, ParameterValue> parameters = new LinkedHashMap<>();
        List<NodeDescriptor> nodes = new ArrayList<>();
        readFile(file, arguments, "/", List.of(), parameters, nodes);
        return new LaunchConfig(parameters, nodes);
    }

    private void readFile(String file,
                          Map<String, String> passedArgs,
                          String namespace,
                          List<Remapping> remappings,
                          Map<String, ParameterValue> parameters,
                          List<NodeDescriptor> nodes) {
        Element root = parse(file);
        if (!"launch".equals(root.getTagName())) {
            throw new LaunchFileException(
                "expected <launch> as root element of " + file + " but found <" + root.getTagName() + ">");
        }
        Scope scope = new Scope(file, namespace, new HashMap<>(), passedArgs, new ArrayList<>(remappings));
        readChildren(root, scope, parameters, nodes);
    }

    private Element parse(String file) {
        String content = files.read(file);
        try {
            DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
            factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
            factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
            DocumentBuilder builder = factory.newDocumentBuilder();
            Document document = builder.parse(new InputSource(new StringReader(content)));
            return document.getDocumentElement();
        } catch (ParserConfigurationException | SAXException | IOException e) {
            throw new LaunchFileException("failed to parse launch file: " + file, e);
        }
    }

    private void readChildren(Element parent,
                              Scope scope,
                              Map<String, ParameterValue> parameters,
                              List<NodeDescriptor> nodes) {
        for (Element element : children(parent)) {
            if (!isEnabled(element, scope)) {
                continue;
            }
            switch (element.getTagName()) {
                case "arg" -> readArg(element, scope);
                case "group" -> {
                    String ns = joinNamespace(scope.namespace(), substitute(element.getAttribute("ns"), scope));
                    readChildren(element, scope.child(ns), parameters, nodes);
                }
                case "remap" -> scope.remappings().add(readRemap(element, scope));
                case "param" -> readParam(element, scope, scope.namespace(), parameters);
                case "rosparam" -> readRosparam(element, scope, scope.namespace(), parameters);
                case "node" -> nodes.add(readNode(element, scope, parameters));
                case "include" -> readInclude(element, scope, parameters, nodes);
                default -> logger.debug("skipping <{}> in {}", element.getTagName(), scope.file());
            }
        }
    }

    private void readArg(Element element, Scope scope) {
        String name = required(element, "name", scope);
        if (element.hasAttribute("value")) {
            scope.args().put(name, substitute(element.getAttribute("value"), scope));
        } else if (scope.passedArgs().containsKey(name)) {
            scope.args().put(name, scope.passedArgs().get(name));
        } else if (element.hasAttribute("default")) {
            scope.args().put(name, substitute(element.getAttribute("default"), scope));
        }
    }

    private Remapping readRemap(Element element, Scope scope) {
        return new Remapping(required(element, "from", scope), required(element, "to", scope));
    }

    private NodeDescriptor readNode(Element element, Scope scope, Map<String, ParameterValue> parameters) {
        String pkg = required(element, "pkg", scope);
        String type = required(element, "type", scope);
        String name = required(element, "name", scope);
        String namespace = joinNamespace(scope.namespace(), substitute(element.getAttribute("ns"), scope));
        String args = substitute(element.getAttribute("args"), scope);
        String privateNamespace = namespace + name + "/";

        List<Remapping> remappings = new ArrayList<>(scope.remappings());
        for (Element child : children(element)) {
            if (!isEnabled(child, scope)) {
                continue;
            }
            switch (child.getTagName()) {
                case "remap" -> remappings.add(readRemap(child, scope));
                case "param" -> readParam(child, scope, privateNamespace, parameters);
                case "rosparam" -> readRosparam(child, scope, privateNamespace, parameters);
                default -> logger.debug("skipping <{}> in node [{}]", child.getTagName(), name);
            }
        }

        logger.debug("found node [{}] of type [{}/{}] in namespace [{}]", name, pkg, type, namespace);
        return new NodeDescriptor(name, pkg, type, namespace, args, remappings);
    }

    private void readInclude(Element element,
                             Scope scope,
                             Map<String, ParameterValue> parameters,
                             List<NodeDescriptor> nodes) {
        String file = required(element, "file", scope);
        String namespace = joinNamespace(scope.namespace(), substitute(element.getAttribute("ns"), scope));

        Map<String, String> passed = new HashMap<>();
        for (Element child : children(element)) {
            if ("arg".equals(child.getTagName()) && isEnabled(child, scope)) {
                passed.put(required(child, "name", scope), required(child, "value", scope));
            }
        }
        logger.debug("including launch file [{}] into namespace [{}]", file, namespace);
        readFile(file, passed, namespace, scope.remappings(), parameters, nodes);
    }

    private void readParam(Element element,
                           Scope scope,
                           String namespace,
                           Map<String, ParameterValue> parameters) {
        String name = qualifyParameter(namespace, required(element, "name", scope));
        String type = element.hasAttribute("type") ? element.getAttribute("type") : "auto";

        String text;
        if (element.hasAttribute("value")) {
            text = substitute(element.getAttribute("value"), scope);
        } else if (element.hasAttribute("textfile")) {
            text = files.read(substitute(element.getAttribute("textfile"), scope));
            type = element.hasAttribute("type") ? type : "str";
        } else if (element.hasAttribute("command")) {
            text = shell.runAndCapture(substitute(element.getAttribute("command"), scope));
            type = element.hasAttribute("type") ? type : "str";
        } else {
            throw new LaunchFileException(
                "<param name=\"" + name + "\"> needs a value, textfile or command attribute in " + scope.file());
        }

        parameters.put(name, convert(text, type, name));
    }

    private void readRosparam(Element element,
                              Scope scope,
                              String namespace,
                              Map<String, ParameterValue> parameters) {
        String command = element.hasAttribute("command") ? element.getAttribute("command") : "load";
        if (!"load".equals(command)) {
            logger.debug("skipping <rosparam command=\"{}\"> in {}", command, scope.file());
            return;
        }

        String ns = joinNamespace(namespace, substitute(element.getAttribute("ns"), scope));
        String text;
        if (element.hasAttribute("file")) {
            text = files.read(substitute(element.getAttribute("file"), scope));
        } else {
            text = element.getTextContent();
            if ("true".equals(element.getAttribute("subst_value"))) {
                text = substitute(text, scope);
            }
        }

        Object loaded = parseYaml(text, scope.file());
        if (loaded == null) {
            return;
        }
        if (element.hasAttribute("param")) {
            String name = qualifyParameter(ns, substitute(element.getAttribute("param"), scope));
            parameters.put(name, ParameterValue.of(loaded));
            if (loaded instanceof Map<?, ?> map) {
                flatten(name + "/", map, parameters);
            }
        } else if (loaded instanceof Map<?, ?> map) {
            flatten(ns, map, parameters);
        } else {
            throw new LaunchFileException(
                "<rosparam> without a param attribute must load a mapping in " + scope.file());
        }
    }

    /**
     * Stores every entry of a mapping under {@code ns}. Nested mappings are stored both as a
     * whole and leaf by leaf, so {@code a: {b: 1}} yields {@code ns + "a"} and {@code ns + "a/b"}.
     */
    private static void flatten(String ns, Map<?, ?> map, Map<String, ParameterValue> parameters) {
        map.forEach((key, value) -> {
            String name = ns + key;
            parameters.put(name, ParameterValue.of(value));
            if (value instanceof Map<?, ?> nested) {
                flatten(name + "/", nested, parameters);
            }
        });
    }

    private ParameterValue convert(String text, String type, String name) {
        try {
            return switch (type) {
                case "str", "string" -> ParameterValue.of(text);
                case "int" -> ParameterValue.of(Long.parseLong(text.trim()));
                case "double" -> ParameterValue.of(Double.parseDouble(text.trim()));
                case "bool", "boolean" -> ParameterValue.of(parseBoolean(text.trim(), name));
                case "yaml" -> {
                    Object loaded = parseYaml(text, name);
                    yield loaded == null ? ParameterValue.of("") : ParameterValue.of(loaded);
                }
                case "auto" -> autoConvert(text);
                default -> throw new LaunchFileException("unsupported type [" + type + "] for parameter " + name);
            };
        } catch (NumberFormatException e) {
            throw new LaunchFileException("invalid " + type + " value for parameter " + name + ": " + text, e);
        }
    }

    private static ParameterValue autoConvert(String text) {
        String trimmed = text.trim();
        if (trimmed.equalsIgnoreCase("true") || trimmed.equalsIgnoreCase("false")) {
            return ParameterValue.of(Boolean.parseBoolean(trimmed));
        }
        try {
            return ParameterValue.of(Long.parseLong(trimmed));
        } catch (NumberFormatException notAnInt) {
            try {
                return ParameterValue.of(Double.parseDouble(trimmed));
            } catch (NumberFormatException notADouble) {
                return ParameterValue.of(text);
            }
        }
    }

    private static boolean parseBoolean(String text, String name) {
        if (text.equalsIgnoreCase("true") || text.equals("1")) {
            return true;
        }
        if (text.equalsIgnoreCase("false") || text.equals("0")) {
            return false;
        }
        throw new LaunchFileException("invalid bool value for parameter " + name + ": " + text);
    }

    private Object parseYaml(String text, String origin) {
        try {
            return yaml.readValue(text, Object.class);
        } catch (JsonProcessingException e) {
            throw new LaunchFileException("invalid YAML in " + origin, e);
        }
    }

    private boolean isEnabled(Element element, Scope scope) {
        if (element.hasAttribute("if") && element.hasAttribute("unless")) {
            throw new LaunchFileException(
                "<" + element.getTagName() + "> cannot set both 'if' and 'unless' in " + scope.file());
        }
        if (element.hasAttribute("if")) {
            return parseCondition(substitute(element.getAttribute("if"), scope), scope);
        }
        if (element.hasAttribute("unless")) {
            return !parseCondition(substitute(element.getAttribute("unless"), scope), scope);
        }
        return true;
    }

    private static boolean parseCondition(String value, Scope scope) {
        String trimmed = value.trim();
        if (trimmed.equalsIgnoreCase("true") || trimmed.equals("1")) {
            return true;
        }
        if (trimmed.equalsIgnoreCase("false") || trimmed.equals("0")) {
            return false;
        }
        throw new LaunchFileException("invalid if/unless value [" + value + "] in " + scope.file());
    }

    /**
     * Expands {@code $(arg ...)} and {@code $(find ...)} in an attribute value.
     */
    String substitute(String value, Scope scope) {
        if (value == null || value.indexOf('$') < 0) {
            return value == null ? "" : value;
        }
        Matcher matcher = SUBSTITUTION.matcher(value);
        StringBuilder result = new StringBuilder();
        while (matcher.find()) {
            String command = matcher.group(1);
            String operand = matcher.group(2) == null ? "" : matcher.group(2).trim();
            String replacement = switch (command) {
                case "arg" -> {
                    String arg = scope.args().get(operand);
                    if (arg == null) {
                        throw new LaunchFileException("argument [" + operand + "] is not set in " + scope.file());
                    }
                    yield arg;
                }
                case "find" -> shell.runAndCapture(rospackCommand + " " + operand).trim();
                default -> throw new LaunchFileException(
                    "unsupported substitution $(" + command + ") in " + scope.file());
            };
            matcher.appendReplacement(result, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(result);
        return result.toString();
    }

    private String required(Element element, String attribute, Scope scope) {
        if (!element.hasAttribute(attribute)) {
            throw new LaunchFileException(
                "<" + element.getTagName() + "> is missing attribute [" + attribute + "] in " + scope.file());
        }
        return substitute(element.getAttribute(attribute), scope);
    }

    private static List<Element> children(Element parent) {
        List<Element> elements = new ArrayList<>();
        NodeList nodes = parent.getChildNodes();
        for (int i = 0; i < nodes.getLength(); i++) {
            Node node = nodes.item(i);
            if (node.getNodeType() == Node.ELEMENT_NODE) {
                elements.add((Element) node);
            }
        }
        return elements;
    }

    /**
     * Joins a child namespace onto a base namespace. Both arguments and the result use the
     * {@code /a/b/} form; an absolute child replaces the base, an empty child keeps it.
     */
    static String joinNamespace(String base, String child) {
        if (child == null || child.isEmpty()) {
            return normalizeNamespace(base);
        }
        if (child.startsWith("/")) {
            return normalizeNamespace(child);
        }
        return normalizeNamespace(normalizeNamespace(base) + child);
    }

    private static String normalizeNamespace(String ns) {
        String result = ns.startsWith("/") ? ns : "/" + ns;
        return result.endsWith("/") ? result : result + "/";
    }

    static String qualifyParameter(String namespace, String name) {
        if (name.startsWith("/")) {
            return name;
        }
        String relative = name.startsWith("~") ? name.substring(1) : name;
        return normalizeNamespace(namespace) + relative;
    }

    /**
     * Lexical state while reading one launch file: arguments are shared by the whole file,
     * namespace and remappings follow group nesting.
     */
    record Scope(String file,
                 String namespace,
                 Map<String, String> args,
                 Map<String, String> passedArgs,
                 List<Remapping> remappings) {

        Scope child(String childNamespace) {
            return new Scope(file, childNamespace, args, passedArgs, new ArrayList<>(remappings));
        }
    }
}
