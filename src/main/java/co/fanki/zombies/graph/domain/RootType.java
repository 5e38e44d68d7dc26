package co.fanki.zombies.graph.domain;

/**
 * Why a symbol is an active root (an entry point of the system).
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public enum RootType {

    /** HTTP or API endpoint controller. */
    CONTROLLER,

    /** Scheduled job or cron task. */
    SCHEDULER,

    /** Message queue listener or event handler. */
    LISTENER,

    /** Application main entry point. */
    MAIN,

    COMMAND_LINE,

    TEST,

    /** Public API of a library consumed outside the scanned repositories. */
    LIBRARY,

    CUSTOM

}
