package com.address.resolution.core.model;

/**
 * Script of a premises address returned by the lookup service.
 */
public enum Language {
    CHINESE,
    ENGLISH
}
