package com.opcpub.nodeconfig.file;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * User name and password as stored in the published nodes file, both already encrypted.
 * Opaque here: decryption happens in the session layer when it authenticates.
 */
public final class EncryptedCredential {

    private final String userName;
    private final String password;

    @JsonCreator
    public EncryptedCredential(
            @JsonProperty("userName") @JsonAlias("UserName") String userName,
            @JsonProperty("password") @JsonAlias("Password") String password) {
        this.userName = userName;
        this.password = password;
    }

    public String getUserName() {
        return userName;
    }

    public String getPassword() {
        return password;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        EncryptedCredential that = (EncryptedCredential) o;
        return Objects.equals(userName, that.userName) && Objects.equals(password, that.password);
    }

    @Override
    public int hashCode() {
        return Objects.hash(userName, password);
    }

    /** Never prints the encrypted values. */
    @Override
    public String toString() {
        return "EncryptedCredential{***}";
    }
}
