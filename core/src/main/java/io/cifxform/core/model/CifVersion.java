package io.cifxform.core.model;

/** The CIF dialect a document is written in. */
public enum CifVersion {
    CIF1,
    CIF2,
    MIXED,
    UNKNOWN
}
