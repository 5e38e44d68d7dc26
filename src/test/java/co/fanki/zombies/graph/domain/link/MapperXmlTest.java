package co.fanki.zombies.graph.domain.link;

import co.fanki.zombies.shared.DomainException;
import org.junit.jupiter.api.Test;
import org.xml.sax.SAXParseException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Unit tests for {@link MapperXml}.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class MapperXmlTest {

    @Test
    void whenParsing_givenMapper_shouldReadStatementsInOrder() {
        final MapperXml mapper = MapperXml.parse("""
                <mapper namespace=" com.x.OrderMapper ">
                  <resultMap id="orderMap" type="Order"/>
                  <select id="findOrder">
                    SELECT *
                      FROM orders
                  </select>
                  <insert id='saveOrder'>INSERT INTO orders VALUES (#{o})</insert>
                  <sql id="columns">id, total</sql>
                </mapper>
                """);

        assertEquals("com.x.OrderMapper", mapper.namespace());
        assertEquals(2, mapper.statements().size());

        final MapperXml.Statement find = mapper.statements().get(0);
        assertEquals("findOrder", find.id());
        assertEquals("select", find.tag());
        assertEquals("SELECT * FROM orders", find.sql());
        assertEquals(3, find.line());

        final MapperXml.Statement save = mapper.statements().get(1);
        assertEquals("insert", save.tag());
        assertEquals(7, save.line());
        assertEquals("com.x.OrderMapper.saveOrder", mapper.qualify(save));
    }

    @Test
    void whenParsing_givenOtherRootElement_shouldFail() {
        final DomainException error = assertThrows(DomainException.class,
                () -> MapperXml.parse("<beans><bean id=\"a\"/></beans>"));
        assertEquals("MALFORMED_FRAGMENT", error.getErrorCode());
    }

    @Test
    void whenParsing_givenMissingNamespace_shouldFail() {
        final DomainException error = assertThrows(DomainException.class,
                () -> MapperXml.parse("<mapper><select id=\"a\"/></mapper>"));
        assertEquals("MALFORMED_FRAGMENT", error.getErrorCode());
    }

    @Test
    void whenParsing_givenBrokenXml_shouldFail() {
        final DomainException error = assertThrows(DomainException.class,
                () -> MapperXml.parse("<mapper namespace=\"a\"><select>"));
        assertEquals("MALFORMED_FRAGMENT", error.getErrorCode());
    }

    @Test
    void whenHandlingParserMessages_givenError_shouldRethrowAndIgnoreWarnings()
            throws SAXParseException {
        final MapperXml.LoggingErrorHandler handler =
                new MapperXml.LoggingErrorHandler();
        final SAXParseException problem = new SAXParseException(
                "Element type \"select\" must be followed by attributes",
                null);

        handler.warning(problem);

        assertSame(problem, assertThrows(SAXParseException.class,
                () -> handler.error(problem)));
        assertSame(problem, assertThrows(SAXParseException.class,
                () -> handler.fatalError(problem)));
    }

}
