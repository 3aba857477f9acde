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

/**
 * Data API commands issued by the client. Each constant carries the
 * top-level key the command is sent under.
 */
public enum CommandType {
    FIND("find"),
    FIND_ONE("findOne"),
    INSERT_ONE("insertOne"),
    INSERT_MANY("insertMany"),
    UPDATE_ONE("updateOne"),
    UPDATE_MANY("updateMany"),
    DELETE_ONE("deleteOne"),
    DELETE_MANY("deleteMany"),
    FIND_ONE_AND_UPDATE("findOneAndUpdate"),
    FIND_ONE_AND_REPLACE("findOneAndReplace"),
    FIND_ONE_AND_DELETE("findOneAndDelete"),
    COUNT_DOCUMENTS("countDocuments"),
    ESTIMATED_DOCUMENT_COUNT("estimatedDocumentCount"),
    CREATE_COLLECTION("createCollection"),
    FIND_COLLECTIONS("findCollections"),
    DELETE_COLLECTION("deleteCollection"),
    CREATE_TABLE("createTable"),
    LIST_TABLES("listTables"),
    DROP_TABLE("dropTable");

    private final String command;

    CommandType(String command) {
        this.command = command;
    }

    public String getCommand() {
        return command;
    }

    public static CommandType fromCommand(String command) {
        for (CommandType type : values()) {
            if (type.command.equals(command)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown command: " + command);
    }
}
