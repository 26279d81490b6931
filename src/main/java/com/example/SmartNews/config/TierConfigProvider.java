package com.example.SmartNews.config;

/**
 * Source of tier limits. Callers read through {@link #current()} on every check so a
 * {@link #reload()} takes effect atomically.
 */
public interface TierConfigProvider {

    TierConfigSnapshot current();

    TierConfigSnapshot reload();
}
