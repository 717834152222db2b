package com.analyticshub.common.model;

import java.util.List;

/** Well-known upstream layer identifiers. Layers are open-ended strings; these are the ones rules key on. */
public final class SourceLayers {

    public static final String OBSERVATORY = "observatory";
    public static final String COST_OPS    = "cost-ops";
    public static final String GOVERNANCE  = "governance";
    public static final String CONSENSUS   = "consensus";

    /** Layers analysed when a strategic request names none. */
    public static final List<String> DEFAULT_LAYERS = List.of(OBSERVATORY, COST_OPS, GOVERNANCE, CONSENSUS);

    private SourceLayers() {}
}
