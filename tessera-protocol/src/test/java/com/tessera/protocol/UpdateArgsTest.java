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

package com.tessera.protocol;

import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class UpdateArgsTest {

    @Test
    public void testUpdateOne() {
        ObjectNode payload = UpdateArgs.Builder.filter(Map.of("a", 1))
                .update(Map.of("$set", Map.of("b", 2)))
                .upsert(true)
                .build(CommandType.UPDATE_ONE);
        assertEquals(
                "{\"updateOne\":{\"filter\":{\"a\":1},\"update\":{\"$set\":{\"b\":2}},\"options\":{\"upsert\":true}}}",
                payload.toString()
        );
    }

    @Test
    public void testUpdateManyCarriesPageState() {
        ObjectNode payload = new UpdateArgs()
                .update(Map.of("$inc", Map.of("n", 1)))
                .pageState("next")
                .build(CommandType.UPDATE_MANY);
        assertEquals("{}", payload.path("updateMany").path("filter").toString());
        assertEquals("next", payload.path("updateMany").path("options").path("pageState").asText());
        assertFalse(payload.path("updateMany").path("options").has("upsert"));
    }

    @Test
    public void testFindOneAndReplace() {
        ObjectNode payload = UpdateArgs.Builder.filter(Map.of("_id", "x"))
                .replacement(Map.of("name", "y"))
                .returnDocument(ReturnDocument.AFTER)
                .projection(Map.of("name", 1))
                .build(CommandType.FIND_ONE_AND_REPLACE);
        ObjectNode command = (ObjectNode) payload.get("findOneAndReplace");
        assertEquals("y", command.path("replacement").path("name").asText());
        assertEquals("after", command.path("options").path("returnDocument").asText());
        assertEquals(1, command.path("projection").path("name").asInt());
    }

    @Test
    public void testMissingUpdateIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> new UpdateArgs().build(CommandType.UPDATE_ONE));
        assertThrows(IllegalArgumentException.class, () -> new UpdateArgs().build(CommandType.FIND_ONE_AND_REPLACE));
    }

    @Test
    public void testUnsupportedCommand() {
        assertThrows(IllegalArgumentException.class,
                () -> new UpdateArgs().update(Map.of("$set", Map.of("a", 1))).build(CommandType.FIND));
    }
}
