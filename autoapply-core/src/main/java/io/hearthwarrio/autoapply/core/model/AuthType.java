package io.hearthwarrio.autoapply.core.model;

public enum AuthType {
    SIGN_UP,
    SIGN_IN,
    VERIFY
}
