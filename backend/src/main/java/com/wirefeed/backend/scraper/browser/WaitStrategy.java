package com.wirefeed.backend.scraper.browser;

/**
 * When a navigation counts as finished.
 */
public enum WaitStrategy {
    /** Document complete and no new network resources over a quiet period. */
    NETWORK_IDLE,
    /** Document readyState is "complete". */
    LOAD,
    /** DOM parsed; subresources may still be loading. */
    DOM_CONTENT_LOADED
}
