package co.fanki.zombies.graph.domain.link;

import co.fanki.zombies.shared.DomainException;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.NodeList;
import org.xml.sax.ErrorHandler;
import org.xml.sax.InputSource;
import org.xml.sax.SAXParseException;

import java.io.StringReader;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;

/**
 * Parsed ORM mapping file: a {@code <mapper namespace="...">} root with
 * {@code select}, {@code insert}, {@code update} and {@code delete}
 * statements.
 *
 * <p>Document type declarations are accepted, as every generated mapper
 * carries one, but external DTDs and entities are never loaded.</p>
 *
 * @param namespace the mapped interface, e.g. {@code com.x.UserMapper}
 * @param statements the statements in document order
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record MapperXml(String namespace, List<Statement> statements) {

    private static final Logger LOG = LoggerFactory.getLogger(
            MapperXml.class);

    private static final Set<String> STATEMENT_TAGS = Set.of(
            "select", "insert", "update", "delete");

    /**
     * Parses a mapping file.
     *
     * @param text the file content
     * @return the mapper
     * @throws DomainException with code {@code MALFORMED_FRAGMENT} if the
     *         text is not a mapping file
     */
    public static MapperXml parse(final String text) {
        final Document document;
        try {
            final InputSource source = new InputSource(new StringReader(text));
            document = newBuilder().parse(source);
        } catch (Exception e) {
            throw new DomainException("Mapper XML is not well formed: "
                    + e.getMessage(), "MALFORMED_FRAGMENT", e);
        }

        final Element root = document.getDocumentElement();
        if (!"mapper".equals(root.getTagName())) {
            throw new DomainException("Root element is <" + root.getTagName()
                    + ">, not <mapper>", "MALFORMED_FRAGMENT");
        }
        final String namespace = root.getAttribute("namespace").trim();
        if (namespace.isEmpty()) {
            throw new DomainException("Mapper has no namespace",
                    "MALFORMED_FRAGMENT");
        }

        final List<Statement> statements = new ArrayList<>();
        final NodeList children = root.getChildNodes();
        for (int i = 0; i < children.getLength(); i++) {
            final Node node = children.item(i);
            if (!(node instanceof Element element)) {
                continue;
            }
            final String tag = element.getTagName();
            final String id = element.getAttribute("id").trim();
            if (!STATEMENT_TAGS.contains(tag) || id.isEmpty()) {
                continue;
            }
            statements.add(new Statement(id, tag,
                    collapse(element.getTextContent()), lineOf(text, id)));
        }
        return new MapperXml(namespace, List.copyOf(statements));
    }

    private static DocumentBuilder newBuilder()
            throws ParserConfigurationException {
        final DocumentBuilderFactory factory =
                DocumentBuilderFactory.newInstance();
        factory.setNamespaceAware(false);
        factory.setValidating(false);
        factory.setExpandEntityReferences(false);
        factory.setFeature(
                "http://apache.org/xml/features/nonvalidating/load-external-dtd",
                false);
        factory.setFeature(
                "http://xml.org/sax/features/external-general-entities",
                false);
        factory.setFeature(
                "http://xml.org/sax/features/external-parameter-entities",
                false);
        final DocumentBuilder builder = factory.newDocumentBuilder();
        builder.setErrorHandler(new LoggingErrorHandler());
        return builder;
    }

    private static String collapse(final String sql) {
        return sql == null ? "" : sql.replaceAll("\\s+", " ").trim();
    }

    private static int lineOf(final String text, final String id) {
        int index = text.indexOf("id=\"" + id + "\"");
        if (index < 0) {
            index = text.indexOf("id='" + id + "'");
        }
        if (index < 0) {
            return 1;
        }
        int line = 1;
        for (int i = 0; i < index; i++) {
            if (text.charAt(i) == '\n') {
                line++;
            }
        }
        return line;
    }

    /**
     * Qualified name of a statement, as its interface method is named.
     *
     * @param statement the statement
     * @return {@code namespace.id}
     */
    public String qualify(final Statement statement) {
        return namespace + "." + statement.id();
    }

    /**
     * One mapping statement.
     *
     * @param id the statement id, equal to the interface method name
     * @param tag the element name: select, insert, update or delete
     * @param sql the statement body with whitespace collapsed
     * @param line the line the statement is declared at
     */
    public record Statement(String id, String tag, String sql, int line) {}

    /**
     * Sends parser messages to the log instead of standard error. Errors
     * still abort the parse.
     */
    static final class LoggingErrorHandler implements ErrorHandler {

        @Override
        public void warning(final SAXParseException e) {
            LOG.debug("Mapper XML warning at line {}: {}", e.getLineNumber(),
                    e.getMessage());
        }

        @Override
        public void error(final SAXParseException e) throws SAXParseException {
            LOG.debug("Mapper XML error at line {}: {}", e.getLineNumber(),
                    e.getMessage());
            throw e;
        }

        @Override
        public void fatalError(final SAXParseException e)
                throws SAXParseException {
            LOG.debug("Mapper XML fatal error at line {}: {}",
                    e.getLineNumber(), e.getMessage());
            throw e;
        }
    }

}
