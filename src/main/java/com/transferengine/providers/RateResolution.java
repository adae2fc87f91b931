package com.transferengine.providers;

/**
 * Steps a rate lookup goes through when the cache cannot answer.
 */
enum RateResolution {
    PRIMARY_ATTEMPT,
    FALLBACK_ATTEMPT,
    FAIL
}
