/*
 * Copyright (c) 2025 Aegis Rule Governance
 * Licensed under the Apache License, Version 2.0
 */
package com.aegis.rulegov.api.json;

import com.aegis.rulegov.api.model.ConditionValue;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;

import java.io.IOException;

public class ConditionValueSerializer extends StdSerializer<ConditionValue> {

    public ConditionValueSerializer() {
        super(ConditionValue.class);
    }

    @Override
    public void serialize(ConditionValue value, JsonGenerator gen, SerializerProvider provider) throws IOException {
        if (value instanceof ConditionValue.Num num) {
            gen.writeNumber(num.value());
        } else if (value instanceof ConditionValue.Text text) {
            gen.writeString(text.value());
        } else if (value instanceof ConditionValue.Bool bool) {
            gen.writeBoolean(bool.value());
        } else if (value instanceof ConditionValue.ListOf list) {
            gen.writeStartArray();
            for (ConditionValue item : list.items()) {
                serialize(item, gen, provider);
            }
            gen.writeEndArray();
        } else {
            gen.writeNull();
        }
    }
}
