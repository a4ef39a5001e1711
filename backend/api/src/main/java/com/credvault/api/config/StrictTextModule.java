package com.credvault.api.config;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.deser.std.StdScalarDeserializer;
import com.fasterxml.jackson.databind.module.SimpleModule;
import org.springframework.stereotype.Component;

import java.io.IOException;

/**
 * Jackson module that only accepts JSON strings (or null) for {@code String} properties,
 * so a number or boolean sent as a title is a validation error instead of being coerced.
 */
@Component
public class StrictTextModule extends SimpleModule {

    public StrictTextModule() {
        super("credvault-strict-text");
        addDeserializer(String.class, new StrictStringDeserializer());
    }

    static class StrictStringDeserializer extends StdScalarDeserializer<String> {

        StrictStringDeserializer() {
            super(String.class);
        }

        @Override
        public String deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
            if (p.hasToken(JsonToken.VALUE_STRING)) {
                return p.getText();
            }
            return (String) ctxt.handleUnexpectedToken(String.class, p);
        }
    }
}
