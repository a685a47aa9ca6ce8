/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kroxylicious.spiffe.config;

import java.util.Arrays;
import java.util.Objects;
import java.util.stream.Stream;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * A source of bytes: exactly one of a file, an inline string or inline bytes (base64 encoded in
 * the configuration document).
 *
 * @param filename path of a file to read.
 * @param inlineString the content itself, as text.
 * @param inlineBytes the content itself.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record DataSource(@JsonProperty("filename") @Nullable String filename,
                         @JsonProperty("inlineString") @Nullable String inlineString,
                         @JsonProperty("inlineBytes") @Nullable byte[] inlineBytes) {

    static final String INLINE = "<inline>";

    @JsonCreator
    public DataSource {
        long specified = Stream.of(filename, inlineString, inlineBytes).filter(Objects::nonNull).count();
        if (specified != 1) {
            throw new IllegalConfigurationException("A data source requires exactly one of filename, inlineString or inlineBytes");
        }
        inlineBytes = inlineBytes == null ? null : inlineBytes.clone();
    }

    public static DataSource ofFile(String filename) {
        return new DataSource(filename, null, null);
    }

    public static DataSource ofInlineString(String content) {
        return new DataSource(null, content, null);
    }

    public static DataSource ofInlineBytes(byte[] content) {
        return new DataSource(null, null, content);
    }

    @Override
    @Nullable
    public byte[] inlineBytes() {
        return inlineBytes == null ? null : inlineBytes.clone();
    }

    /**
     * Human readable provenance of this source: the file name, or {@code <inline>}.
     *
     * @return description
     */
    @JsonIgnore
    public String describe() {
        return filename != null ? filename : INLINE;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof DataSource that)) {
            return false;
        }
        return Objects.equals(filename, that.filename)
                && Objects.equals(inlineString, that.inlineString)
                && Arrays.equals(inlineBytes, that.inlineBytes);
    }

    @Override
    public int hashCode() {
        return Objects.hash(filename, inlineString, Arrays.hashCode(inlineBytes));
    }

    @Override
    public String toString() {
        return "DataSource[" + describe() + "]";
    }
}
