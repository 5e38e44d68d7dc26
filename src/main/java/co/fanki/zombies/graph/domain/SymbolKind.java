package co.fanki.zombies.graph.domain;

/**
 * The kind of code entity a {@link CodeSymbol} stands for.
 *
 * <p>Besides the usual language constructs it covers the database and
 * scheduling entities that only the semantic linker discovers.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public enum SymbolKind {

    FUNCTION,

    METHOD,

    CLASS,

    INTERFACE,

    /** A whole source file, used as origin of file-level references. */
    FILE,

    MODULE,

    VARIABLE,

    /** A database table or view. */
    DB_TABLE,

    /** A statement declared in an ORM mapping file. */
    XML_STATEMENT,

    /** A shell or batch script run by a scheduler. */
    SCHEDULER_SCRIPT,

    STORED_PROCEDURE,

    OTHER;

    /**
     * Checks if symbols of this kind live in a database, where names are
     * compared case-insensitively.
     *
     * @return true for tables and stored procedures
     */
    public boolean isDatabaseEntity() {
        return this == DB_TABLE || this == STORED_PROCEDURE;
    }

}
