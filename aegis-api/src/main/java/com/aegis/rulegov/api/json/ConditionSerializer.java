/*
 * Copyright (c) 2025 Aegis Rule Governance
 * Licensed under the Apache License, Version 2.0
 */
package com.aegis.rulegov.api.json;

import com.aegis.rulegov.api.model.Condition;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;

import java.io.IOException;
import java.util.List;

public class ConditionSerializer extends StdSerializer<Condition> {

    private final ConditionValueSerializer valueSerializer = new ConditionValueSerializer();

    public ConditionSerializer() {
        super(Condition.class);
    }

    @Override
    public void serialize(Condition condition, JsonGenerator gen, SerializerProvider provider) throws IOException {
        gen.writeStartObject();
        if (condition instanceof Condition.Leaf leaf) {
            gen.writeStringField("field", leaf.field());
            gen.writeStringField("op", leaf.op());
            if (leaf.value() != null) {
                gen.writeFieldName("value");
                valueSerializer.serialize(leaf.value(), gen, provider);
            }
        } else if (condition instanceof Condition.All all) {
            writeGroup("all", all.conditions(), gen, provider);
        } else if (condition instanceof Condition.Any any) {
            writeGroup("any", any.conditions(), gen, provider);
        }
        gen.writeEndObject();
    }

    private void writeGroup(String name, List<Condition> children, JsonGenerator gen, SerializerProvider provider)
            throws IOException {
        gen.writeArrayFieldStart(name);
        for (Condition child : children) {
            if (child == null) {
                gen.writeNull();
            } else {
                serialize(child, gen, provider);
            }
        }
        gen.writeEndArray();
    }
}
