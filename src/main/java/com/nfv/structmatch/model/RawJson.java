package com.nfv.structmatch.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.nio.charset.StandardCharsets;

/**
 * An already-serialized JSON document. The normalizer decodes it instead of serializing it.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class RawJson {

    private String json;

    public static RawJson of(String json) {
        return new RawJson(json);
    }

    public static RawJson of(byte[] json) {
        return new RawJson(new String(json, StandardCharsets.UTF_8));
    }
}
