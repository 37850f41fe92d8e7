package io.hearthwarrio.autoapply.core.model;

public enum UploadKind {
    RESUME,
    OTHER
}
