/*
 * Copyright (c) 2026 VMware Inc. or its affiliates, All Rights Reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   https://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package reactor.rmqcli.publish;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Splits a text blob into message bodies. Bodies are trimmed and blank ones dropped.
 */
public final class MessageSplitter {

    private MessageSplitter() {
    }

    public static List<String> split(String blob, String delimiter) {
        List<String> messages = new ArrayList<>();
        String[] parts = delimiter.isEmpty()
            ? new String[] {blob}
            : blob.split(Pattern.quote(delimiter), -1);
        for (String part : parts) {
            String trimmed = part.trim();
            if (!trimmed.isEmpty())
                messages.add(trimmed);
        }
        return messages;
    }

    /**
     * Reads a whole UTF-8 file.
     */
    public static String read(Path path) throws IOException {
        return new String(Files.readAllBytes(path), StandardCharsets.UTF_8);
    }

    /**
     * Reads {@code in} to its end as UTF-8.
     */
    public static String read(InputStream in) throws IOException {
        return new String(in.readAllBytes(), StandardCharsets.UTF_8);
    }
}
