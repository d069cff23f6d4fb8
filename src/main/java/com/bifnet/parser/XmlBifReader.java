package com.bifnet.parser;

import com.bifnet.config.ReaderProperties;
import com.bifnet.error.CpdFormatException;
import com.bifnet.error.MalformedDocumentException;
import com.bifnet.graph.BayesNetModels.Edge;
import com.bifnet.validation.XmlBifValidator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.xml.sax.ErrorHandler;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;
import org.xml.sax.SAXParseException;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import java.io.IOException;
import java.io.StringReader;
import java.io.UncheckedIOException;
import java.util.*;
import java.util.regex.Pattern;

import static com.bifnet.parser.ParserDtos.*;

/**
 * Reads XMLBIF 0.3 documents into a {@link BifNetwork}. Everything is extracted in one pass;
 * any structural or table problem aborts the read.
 */
@Slf4j
@Component
public class XmlBifReader {
    private static final Pattern NUMBER_PATTERN = Pattern.compile(
            "[+-]?((\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?|inf|infinity|nan)", Pattern.CASE_INSENSITIVE);
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final DocumentBuilderFactory factory;
    private final XmlBifValidator validator;

    public XmlBifReader(ReaderProperties properties, XmlBifValidator validator) {
        this.validator = validator;
        this.factory = DocumentBuilderFactory.newInstance();
        factory.setNamespaceAware(false);
        factory.setIgnoringComments(true);
        if (properties.isSecureProcessing()) {
            try {
                factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
                factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
                factory.setXIncludeAware(false);
                factory.setExpandEntityReferences(false);
            } catch (ParserConfigurationException e) {
                throw new IllegalStateException("XML parser does not support secure processing", e);
            }
        }
    }

    public BifNetwork read(XmlBifSource source) {
        Element root = parseDocument(source).getDocumentElement();
        Element network = XmlElements.child(root, "NETWORK")
                .orElseThrow(() -> new MalformedDocumentException(List.of(
                        new ParseError("MISSING_NETWORK", "Document has no NETWORK element", root.getTagName(), null))));

        NetworkDoc doc = extract(network);
        List<ParseError> errors = validator.validate(doc);
        if (!errors.isEmpty()) throw new MalformedDocumentException(errors);

        Map<String, List<String>> states = new LinkedHashMap<>();
        Map<String, List<String>> properties = new LinkedHashMap<>();
        List<String> variables = new ArrayList<>();
        for (VariableDoc v : doc.variables()) {
            variables.add(v.name());
            states.put(v.name(), v.outcomes());
            properties.put(v.name(), v.properties());
        }

        Map<String, List<String>> parents = new LinkedHashMap<>();
        for (DefinitionDoc d : doc.definitions()) {
            List<String> reversed = new ArrayList<>(d.givens());
            Collections.reverse(reversed);
            parents.put(d.forVariable(), List.copyOf(reversed));
        }

        List<Edge> edges = new ArrayList<>();
        parents.forEach((child, ps) -> ps.forEach(p -> edges.add(new Edge(p, child))));

        Map<String, CpdTable> cpds = new LinkedHashMap<>();
        for (DefinitionDoc d : doc.definitions()) {
            if (d.table() != null) {
                cpds.put(d.forVariable(), reshape(d.forVariable(), d.table(), states.get(d.forVariable()).size()));
            }
        }

        BifNetwork result = new BifNetwork(doc.name(), List.copyOf(variables),
                Collections.unmodifiableMap(states), Collections.unmodifiableMap(parents),
                List.copyOf(edges), Collections.unmodifiableMap(cpds), Collections.unmodifiableMap(properties));

        List<ParseError> shapeErrors = validator.validateShapes(result);
        if (!shapeErrors.isEmpty()) throw new MalformedDocumentException(shapeErrors);

        log.debug("Read network {} from {}: {} variables, {} edges, {} tables",
                doc.name(), source.describe(), variables.size(), edges.size(), cpds.size());
        return result;
    }

    private Document parseDocument(XmlBifSource source) {
        try {
            DocumentBuilder builder = factory.newDocumentBuilder();
            builder.setErrorHandler(new FailingErrorHandler());
            if (source.path() != null) {
                return builder.parse(source.path().toFile());
            }
            return builder.parse(new InputSource(new StringReader(source.text())));
        } catch (ParserConfigurationException e) {
            throw new IllegalStateException("Cannot create XML parser", e);
        } catch (SAXException e) {
            throw new MalformedDocumentException(
                    new ParseError("INVALID_XML", "Not a well-formed XML document: " + e.getMessage(), null, null), e);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read " + source.describe(), e);
        }
    }

    private NetworkDoc extract(Element network) {
        List<ParseError> errors = new ArrayList<>();
        String name = XmlElements.childText(network, "NAME").orElse(null);

        List<VariableDoc> variables = new ArrayList<>();
        List<Element> variableElements = XmlElements.children(network, "VARIABLE");
        for (int i = 0; i < variableElements.size(); i++) {
            Element variable = variableElements.get(i);
            Optional<String> varName = XmlElements.childText(variable, "NAME");
            if (varName.isEmpty()) {
                errors.add(new ParseError("MISSING_ELEMENT", "VARIABLE #" + (i + 1) + " has no NAME", "VARIABLE", null));
                continue;
            }
            variables.add(new VariableDoc(varName.get(),
                    XmlElements.childTexts(variable, "OUTCOME"),
                    XmlElements.childTexts(variable, "PROPERTY"), i));
        }

        List<DefinitionDoc> definitions = new ArrayList<>();
        List<Element> definitionElements = XmlElements.children(network, "DEFINITION");
        for (int i = 0; i < definitionElements.size(); i++) {
            Element definition = definitionElements.get(i);
            Optional<String> forVar = XmlElements.childText(definition, "FOR");
            if (forVar.isEmpty()) {
                errors.add(new ParseError("MISSING_ELEMENT", "DEFINITION #" + (i + 1) + " has no FOR", "DEFINITION", null));
                continue;
            }
            List<Element> tables = XmlElements.children(definition, "TABLE");
            if (tables.size() > 1) {
                log.warn("DEFINITION for {} has {} TABLE elements, using the last", forVar.get(), tables.size());
            }
            String table = XmlElements.last(definition, "TABLE").map(XmlElements::text).orElse(null);
            definitions.add(new DefinitionDoc(forVar.get(), XmlElements.childTexts(definition, "GIVEN"), table, i));
        }

        if (!errors.isEmpty()) throw new MalformedDocumentException(errors);
        return new NetworkDoc(name, variables, definitions);
    }

    CpdTable reshape(String variable, String tableText, int stateCount) {
        String trimmed = tableText.trim();
        if (trimmed.isEmpty()) {
            throw new CpdFormatException("EMPTY_TABLE", variable, "TABLE of " + variable + " is empty");
        }
        List<Double> values = new ArrayList<>();
        for (String token : WHITESPACE.split(trimmed)) {
            values.add(parseNumber(variable, token));
        }
        if (values.size() % stateCount != 0) {
            throw new CpdFormatException("TABLE_SIZE_MISMATCH", variable,
                    "TABLE of " + variable + " has " + values.size() + " values, not a multiple of its "
                            + stateCount + " states");
        }
        return new CpdTable(stateCount, values.size() / stateCount, values);
    }

    private double parseNumber(String variable, String token) {
        if (!NUMBER_PATTERN.matcher(token).matches()) {
            throw new CpdFormatException("INVALID_NUMBER", variable,
                    "TABLE of " + variable + " contains a non-numeric value: " + token);
        }
        String lower = token.toLowerCase(Locale.ROOT);
        if (lower.endsWith("inf") || lower.endsWith("infinity")) {
            return lower.startsWith("-") ? Double.NEGATIVE_INFINITY : Double.POSITIVE_INFINITY;
        }
        if (lower.endsWith("nan")) return Double.NaN;
        try {
            return Double.parseDouble(token);
        } catch (NumberFormatException e) {
            throw new CpdFormatException("INVALID_NUMBER", variable,
                    "TABLE of " + variable + " contains a non-numeric value: " + token, e);
        }
    }

    private static final class FailingErrorHandler implements ErrorHandler {
        @Override
        public void warning(SAXParseException e) {
            log.debug("XML parser warning at line {}: {}", e.getLineNumber(), e.getMessage());
        }

        @Override
        public void error(SAXParseException e) throws SAXException {
            throw e;
        }

        @Override
        public void fatalError(SAXParseException e) throws SAXException {
            throw e;
        }
    }
}
