package com.example.healthrag;

import java.util.Map;

/**
 * Boundary to the field-encryption collaborator. The engine only ever handles the plaintext
 * side of this interface.
 */
public interface RecordCipher {

    String encrypt(Map<String, Object> fields);

    Map<String, Object> decrypt(String payload);
}
