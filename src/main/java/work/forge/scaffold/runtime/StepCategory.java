package work.forge.scaffold.runtime;

/**
 * Coarse grouping of generation steps, used for reporting and partial runs.
 */
public enum StepCategory {
    BASE,
    DOCS,
    CONFIG,
    DATABASE,
    MIGRATION,
    AUTH,
    ROUTER,
    APP,
    DEPLOYMENT,
    TEST
}
