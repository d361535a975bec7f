/*
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package io.oap.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.google.common.base.Utf8;
import com.google.common.collect.ImmutableList;
import com.google.inject.Inject;
import io.airlift.units.DataSize;
import io.oap.spi.OapException;

import java.util.List;

import static com.fasterxml.jackson.databind.DeserializationFeature.FAIL_ON_TRAILING_TOKENS;
import static com.google.common.base.Strings.isNullOrEmpty;
import static io.airlift.units.DataSize.succinctBytes;
import static io.oap.spi.StandardErrorCode.CACHE_STATUS_TOO_LARGE;
import static io.oap.spi.StandardErrorCode.INVALID_CACHE_STATUS;
import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Wire format of the fiber cache status batch an executor reports with each heartbeat:
 * a JSON array of {@link FileCacheStatus}. Text after the array makes the payload invalid.
 */
public class FileCacheStatusSerde
{
    private static final TypeReference<List<FileCacheStatus>> STATUS_LIST_TYPE = new TypeReference<>() {};

    private final ObjectReader reader;
    private final ObjectWriter writer;
    private final DataSize maxPayloadSize;

    @Inject
    public FileCacheStatusSerde(ObjectMapper objectMapper, CacheLocationConfig config)
    {
        requireNonNull(objectMapper, "objectMapper is null");
        this.reader = objectMapper.readerFor(STATUS_LIST_TYPE).with(FAIL_ON_TRAILING_TOKENS);
        this.writer = objectMapper.writerFor(STATUS_LIST_TYPE);
        this.maxPayloadSize = requireNonNull(config, "config is null").getMaxPayloadSize();
    }

    public String serialize(List<FileCacheStatus> statuses)
    {
        try {
            return writer.writeValueAsString(ImmutableList.copyOf(statuses));
        }
        catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cache status batch could not be converted to JSON", e);
        }
    }

    /**
     * Decodes the whole batch or fails with an {@link OapException}; a failed decode
     * never yields a partial batch.
     */
    public List<FileCacheStatus> deserialize(String payload)
    {
        if (isNullOrEmpty(payload)) {
            return ImmutableList.of();
        }

        long payloadSize = Utf8.encodedLength(payload);
        if (payloadSize > maxPayloadSize.toBytes()) {
            throw new OapException(CACHE_STATUS_TOO_LARGE, format("Cache status payload of %s exceeds the limit of %s", succinctBytes(payloadSize), maxPayloadSize));
        }

        List<FileCacheStatus> statuses;
        try {
            statuses = reader.readValue(payload);
        }
        catch (JsonProcessingException e) {
            throw new OapException(INVALID_CACHE_STATUS, "Invalid cache status payload: " + e.getMessage(), e);
        }
        if (statuses == null) {
            throw new OapException(INVALID_CACHE_STATUS, "Cache status payload is null");
        }
        if (statuses.contains(null)) {
            throw new OapException(INVALID_CACHE_STATUS, "Cache status payload contains a null entry");
        }
        return ImmutableList.copyOf(statuses);
    }
}
