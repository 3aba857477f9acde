/*
 * Copyright (c) 2024-2025 Tessera
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.tessera.protocol.schema;

import com.fasterxml.jackson.databind.JsonNode;
import com.tessera.common.JSONUtils;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

public class ColumnTypeDescriptorTest {

    private static ColumnTypeDescriptor parse(String json) {
        return ColumnTypeDescriptor.fromJson(JSONUtils.readTree(json));
    }

    @Test
    public void testScalar() {
        ColumnTypeDescriptor descriptor = parse("{\"type\":\"text\"}");
        assertEquals(new ColumnTypeDescriptor.Scalar(ColumnType.TEXT), descriptor);
        assertEquals("{\"type\":\"text\"}", descriptor.toJson().toString());
    }

    @Test
    public void testBareStringIsCoerced() {
        assertEquals(new ColumnTypeDescriptor.Scalar(ColumnType.INT), ColumnTypeDescriptor.coerce("int"));
        assertEquals(new ColumnTypeDescriptor.Scalar(ColumnType.BOOLEAN), ColumnTypeDescriptor.coerce(Map.of("type", "boolean")));
    }

    @Test
    public void testVector() {
        ColumnTypeDescriptor descriptor = parse("{\"type\":\"vector\",\"dimension\":3}");
        assertThat(descriptor).isInstanceOf(ColumnTypeDescriptor.Vector.class);
        assertEquals(3, ((ColumnTypeDescriptor.Vector) descriptor).dimension());
    }

    @Test
    public void testValuedAndKeyValued() {
        assertEquals(
                new ColumnTypeDescriptor.Valued(ColumnTypeDescriptor.ValuedKind.SET, ColumnType.TEXT),
                parse("{\"type\":\"set\",\"valueType\":\"text\"}")
        );
        assertEquals(
                new ColumnTypeDescriptor.KeyValued(ColumnType.TEXT, ColumnType.BIGINT),
                parse("{\"type\":\"map\",\"keyType\":\"text\",\"valueType\":\"bigint\"}")
        );
    }

    @Test
    public void testUnsupported() {
        ColumnTypeDescriptor descriptor = parse(
                "{\"type\":\"UNSUPPORTED\",\"apiSupport\":{\"cqlDefinition\":\"frozen<tuple<int,int>>\"," +
                        "\"createTable\":false,\"insert\":false,\"read\":true,\"filter\":false}}"
        );
        assertThat(descriptor).isInstanceOf(ColumnTypeDescriptor.Unsupported.class);
        assertEquals("frozen<tuple<int,int>>", descriptor.apiSupport().cqlDefinition());
        assertEquals(true, descriptor.apiSupport().read());
    }

    @Test
    public void testUnknownTypeKeepsRawPayload() {
        String json = "{\"type\":\"tuple\",\"valueTypes\":[\"int\",\"text\"]}";
        ColumnTypeDescriptor descriptor = parse(json);
        assertThat(descriptor).isInstanceOf(ColumnTypeDescriptor.Unknown.class);
        assertEquals(json, descriptor.toJson().toString());
        assertNull(descriptor.apiSupport());
    }

    @Test
    public void testUnknownValueTypeFallsBackToUnknown() {
        ColumnTypeDescriptor descriptor = parse("{\"type\":\"list\",\"valueType\":{\"type\":\"userDefined\",\"udtName\":\"address\"}}");
        assertThat(descriptor).isInstanceOf(ColumnTypeDescriptor.Unknown.class);
        JsonNode raw = ((ColumnTypeDescriptor.Unknown) descriptor).raw();
        assertEquals("address", raw.path("valueType").path("udtName").asText());
    }
}
