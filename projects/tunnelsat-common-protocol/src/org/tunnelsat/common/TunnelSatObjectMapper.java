package org.tunnelsat.common;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;


public class TunnelSatObjectMapper extends ObjectMapper {

    private static final long serialVersionUID = 1L;

    public TunnelSatObjectMapper() {
        this(true);
    }

    public TunnelSatObjectMapper(boolean indent) {
        if (indent) {
            enable(SerializationFeature.INDENT_OUTPUT);
        }
        enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS);
        disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

}
