package app.taxguide.ask.entitlement.domain.type;

public enum AccessVia {
    library,
    cache,
    credit
}
