package com.specharvest.domain.model;

/**
 * Ways of issuing an outbound fetch.
 */
public enum ChannelKind {
    /** Plain request without intermediary. */
    DIRECT,
    /** Request routed through the next proxy of a rotating pool. */
    PROXY_ROTATED,
    /** Request delegated to a third-party rendering API with rotating keys. */
    EXTERNAL_RENDER_PROXY,
    /** External rendering API first, direct connection once its keys are exhausted. */
    FAILOVER
}
