package com.claimvoyant.client;

import java.util.Map;

public interface SecretStore {

    /**
     * Reads a JSON secret as a flat string map.
     */
    Map<String, String> getSecret(String name);
}
