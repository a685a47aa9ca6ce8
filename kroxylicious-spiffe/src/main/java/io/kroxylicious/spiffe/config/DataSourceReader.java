/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kroxylicious.spiffe.config;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import edu.umd.cs.findbugs.annotations.NonNull;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;

/**
 * Resolves a {@link DataSource} to its bytes.
 */
public final class DataSourceReader {

    private DataSourceReader() {
    }

    /**
     * Reads the content of the data source.
     *
     * @param dataSource source
     * @return the bytes, never empty
     * @throws IOException if the file cannot be read or the source is empty
     */
    @NonNull
    @SuppressFBWarnings(value = "PATH_TRAVERSAL_IN", justification = "Paths are provided by the administrator via the validator configuration.")
    public static byte[] read(@NonNull DataSource dataSource) throws IOException {
        byte[] content;
        if (dataSource.filename() != null) {
            content = Files.readAllBytes(Path.of(dataSource.filename()));
        }
        else if (dataSource.inlineString() != null) {
            content = dataSource.inlineString().getBytes(StandardCharsets.UTF_8);
        }
        else {
            content = dataSource.inlineBytes();
        }
        if (content.length == 0) {
            throw new IOException("Data source " + dataSource.describe() + " is empty");
        }
        return content;
    }
}
