/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openunitops.snapshot;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.powsybl.commons.PowsyblException;

import java.io.*;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * JSON form of a snapshot, for debugging. Values that were not recorded are omitted.
 *
 * @author Geoffroy Jamgotchian {@literal <geoffroy.jamgotchian at rte-france.com>}
 */
public final class SnapshotJsonSerializer {

    public static final String VERSION = "1.0";

    private SnapshotJsonSerializer() {
    }

    public static void write(Snapshot snapshot, Path file) {
        try (Writer writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
            write(snapshot, writer);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public static void write(Snapshot snapshot, Writer writer) {
        Objects.requireNonNull(snapshot);
        Objects.requireNonNull(writer);
        try (JsonGenerator jsonGenerator = new JsonFactory()
                .createGenerator(writer)
                .useDefaultPrettyPrinter()) {
            jsonGenerator.writeStartObject();
            jsonGenerator.writeStringField("version", VERSION);
            jsonGenerator.writeStringField("block", snapshot.getBlockPath());
            jsonGenerator.writeBooleanField("includeValues", snapshot.getSpec().isIncludeValues());
            jsonGenerator.writeBooleanField("onlyFixed", snapshot.getSpec().isOnlyFixed());

            jsonGenerator.writeFieldName("records");
            jsonGenerator.writeStartArray();
            for (StateRecord stateRecord : snapshot.getRecords()) {
                jsonGenerator.writeStartObject();
                jsonGenerator.writeStringField("path", stateRecord.path());
                jsonGenerator.writeStringField("kind", stateRecord.kind().name());
                if (stateRecord.kind() == StateRecord.Kind.VARIABLE) {
                    if (stateRecord.hasValue()) {
                        jsonGenerator.writeNumberField("value", stateRecord.value());
                    }
                    jsonGenerator.writeBooleanField("fixed", stateRecord.fixed());
                } else {
                    jsonGenerator.writeBooleanField("active", stateRecord.active());
                }
                jsonGenerator.writeEndObject();
            }
            jsonGenerator.writeEndArray();

            jsonGenerator.writeEndObject();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public static Snapshot read(Path file) {
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            return read(reader);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public static Snapshot read(Reader reader) {
        Objects.requireNonNull(reader);
        JsonNode root;
        try {
            root = new ObjectMapper().readTree(reader);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        String version = root.path("version").asText();
        if (!VERSION.equals(version)) {
            throw new PowsyblException("Unsupported snapshot version: '" + version + "'");
        }
        StoreSpec spec = root.path("includeValues").asBoolean()
                ? StoreSpec.valueIsFixedIsActive(root.path("onlyFixed").asBoolean())
                : StoreSpec.isFixedIsActive();
        List<StateRecord> records = new ArrayList<>();
        for (JsonNode node : root.path("records")) {
            String path = node.path("path").asText();
            StateRecord.Kind kind = StateRecord.Kind.valueOf(node.path("kind").asText());
            if (kind == StateRecord.Kind.VARIABLE) {
                double value = node.has("value") ? node.get("value").asDouble() : Double.NaN;
                records.add(StateRecord.variable(path, value, node.path("fixed").asBoolean()));
            } else {
                records.add(StateRecord.equation(path, node.path("active").asBoolean()));
            }
        }
        return new Snapshot(root.path("block").asText(), spec, records);
    }
}
