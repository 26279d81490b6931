package com.example.SmartNews.config;

/**
 * Read-only access to the channel catalogue.
 */
public interface SourceConfigProvider {

    SourceConfigSnapshot current();

    SourceConfigSnapshot reload();
}
