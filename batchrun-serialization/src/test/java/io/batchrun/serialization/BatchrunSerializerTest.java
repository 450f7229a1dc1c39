package io.batchrun.serialization;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.batchrun.core.command.ParameterSpec;
import io.batchrun.core.command.ParameterType;
import io.batchrun.core.compactor.EntryData;
import io.batchrun.core.exception.BatchrunException;
import io.batchrun.core.exception.ErrorCode;
import io.batchrun.core.run.LogEntryKind;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class BatchrunSerializerTest {

    private static final Instant START = Instant.parse("2024-01-01T08:00:00Z");

    @Test
    void entryData_writesVersionOneLayout() {
        EntryData data = new EntryData(1, 1, START, List.of(0L, 5L), List.of(1, 2), List.of(6, 4));

        assertThat(BatchrunSerializer.entryDataToJson(data))
                .isEqualTo(
                        "{\"v\":1,\"p\":1,\"s\":\"2024-01-01T08:00:00.000000+00:00\","
                                + "\"d\":[[0,5],[1,2],[6,4]]}");
    }

    @Test
    void entryData_writesEmptyLog() {
        EntryData empty = EntryData.encode(List.of(), EntryData.DEFAULT_PRECISION_MICROS);

        assertThat(BatchrunSerializer.entryDataToJson(empty))
                .isEqualTo("{\"v\":1,\"p\":1,\"s\":\"\",\"d\":[[],[],[]]}");
        assertThat(BatchrunSerializer.entryDataFromJson("{\"v\":1,\"p\":1,\"s\":\"\",\"d\":[[],[],[]]}"))
                .isEqualTo(empty);
    }

    @Test
    void entryData_readsOffsetTimestampWithoutFraction() {
        EntryData data =
                BatchrunSerializer.entryDataFromJson(
                        "{\"v\": 1, \"p\": 1000, \"s\": \"2024-01-01T10:00:00+02:00\","
                                + " \"d\": [[0, 1500], [1, 2], [3, 3]]}");

        assertThat(data.items())
                .containsExactly(
                        new EntryData.Item(START, LogEntryKind.STDOUT, 3),
                        new EntryData.Item(START.plusMillis(1500), LogEntryKind.STDERR, 3));
    }

    @Test
    void entryData_roundTripKeepsMicroseconds() {
        EntryData data =
                EntryData.encode(
                        List.of(
                                new EntryData.Item(START.plusNanos(123_456_000), LogEntryKind.STDOUT, 1),
                                new EntryData.Item(START.plusSeconds(2), LogEntryKind.STDERR, 0)),
                        1);

        EntryData restored =
                BatchrunSerializer.entryDataFromJson(BatchrunSerializer.entryDataToJson(data));

        assertThat(restored).isEqualTo(data);
        assertThat(restored.start()).isEqualTo(START.plusNanos(123_456_000));
    }

    @Test
    void entryData_roundTripKeepsNanosecondTimesWithinPrecision() {
        List<EntryData.Item> items =
                List.of(
                        new EntryData.Item(START.plusNanos(700), LogEntryKind.STDOUT, 1),
                        new EntryData.Item(START.plusNanos(1_900), LogEntryKind.STDOUT, 1),
                        new EntryData.Item(START.plusNanos(3_200), LogEntryKind.STDERR, 1));
        EntryData data = EntryData.encode(items, 1);

        EntryData restored =
                BatchrunSerializer.entryDataFromJson(BatchrunSerializer.entryDataToJson(data));

        assertThat(restored).isEqualTo(data);
        List<EntryData.Item> decoded = restored.items();
        for (int i = 0; i < items.size(); i++) {
            long error = Math.abs(decoded.get(i).time().getNano() - items.get(i).time().getNano());
            assertThat(error).isLessThanOrEqualTo(500);
        }
    }

    @ParameterizedTest
    @CsvSource(
            delimiter = '|',
            value = {
                "{\"v\":2,\"p\":1,\"s\":\"\",\"d\":[[],[],[]]}                      | Unsupported version",
                "{\"p\":1,\"s\":\"\",\"d\":[[],[],[]]}                              | Unsupported version",
                "{\"v\":1,\"p\":\"1\",\"s\":\"\",\"d\":[[],[],[]]}                  | Invalid precision",
                "{\"v\":1,\"p\":0,\"s\":\"\",\"d\":[[],[],[]]}                      | Invalid precision",
                "{\"v\":1,\"p\":1,\"s\":null,\"d\":[[],[],[]]}                      | Invalid start timestamp",
                "{\"v\":1,\"p\":1,\"s\":\"2024-01-01T08:00:00\",\"d\":[[0],[1],[1]]} | Invalid start timestamp",
                "{\"v\":1,\"p\":1,\"s\":\"\",\"d\":{}}                              | Invalid data type",
                "{\"v\":1,\"p\":1,\"s\":\"\",\"d\":[[],[]]}                         | Data length mismatch",
                "{\"v\":1,\"p\":1,\"s\":\"\",\"d\":[[0],[1],[1]]}                   | without start timestamp",
                "{\"v\":1,\"p\":1,\"s\":\"2024-01-01T08:00:00Z\",\"d\":[[0],[3],[1]]} | Unknown log entry kind",
                "{\"v\":1,\"p\":1,\"s\":\"2024-01-01T08:00:00Z\",\"d\":[[0,1],[1],[1]]} | Data length mismatch"
            })
    void entryData_rejectsMalformedMetadata(String json, String message) {
        assertThatThrownBy(() -> BatchrunSerializer.entryDataFromJson(json))
                .isInstanceOf(BatchrunException.class)
                .hasMessageContaining(message)
                .extracting(e -> ((BatchrunException) e).getCode())
                .isEqualTo(ErrorCode.INVALID_METADATA);
    }

    @Test
    void entryData_rejectsNonJson() {
        assertThatThrownBy(() -> BatchrunSerializer.entryDataFromJson("{not json"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageStartingWith("Failed to deserialize entry data");
    }

    @Test
    void parameters_readTranslatedDescriptions() {
        Map<String, ParameterSpec> parameters =
                BatchrunSerializer.parametersFromJson(
                        """
                        {
                          "rent_id": {
                            "type": "int",
                            "required": false,
                            "description": {"fi": "Vuokrauksen tunnus", "en": "Rent id"}
                          },
                          "time_range_start": {"type": "datetime", "required": true}
                        }
                        """);

        assertThat(parameters)
                .containsExactly(
                        Map.entry("rent_id", new ParameterSpec(ParameterType.INT, false, "Rent id")),
                        Map.entry(
                                "time_range_start",
                                new ParameterSpec(ParameterType.DATETIME, true, "")));
    }

    @Test
    void parameters_roundTrip() {
        Map<String, ParameterSpec> parameters = new LinkedHashMap<>();
        parameters.put("app", new ParameterSpec(ParameterType.STRING, true, "Application label"));
        parameters.put("verbose", ParameterSpec.optional(ParameterType.BOOL));

        String json = BatchrunSerializer.parametersToJson(parameters);

        assertThat(json)
                .isEqualTo(
                        "{\"app\":{\"type\":\"string\",\"required\":true,"
                                + "\"description\":\"Application label\"},"
                                + "\"verbose\":{\"type\":\"bool\",\"required\":false}}");
        assertThat(BatchrunSerializer.parametersFromJson(json)).isEqualTo(parameters);
    }

    @Test
    void parameters_rejectUnknownType() {
        assertThatThrownBy(
                        () -> BatchrunSerializer.parametersFromJson("{\"x\":{\"type\":\"float\"}}"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Unknown parameter type: float");
    }

    @Test
    void arguments_keepOrderAndTypes() {
        Map<String, Object> arguments =
                BatchrunSerializer.argumentsFromJson(
                        "{\"rent_id\": 123, \"dry\": true, \"day\": \"2024-01-01\", \"big\": 9999999999}");

        assertThat(arguments).containsKeys("rent_id", "dry", "day", "big");
        assertThat(arguments.keySet()).containsExactly("rent_id", "dry", "day", "big");
        assertThat(arguments.get("rent_id")).isEqualTo(123);
        assertThat(arguments.get("dry")).isEqualTo(true);
        assertThat(arguments.get("big")).isEqualTo(9_999_999_999L);
        assertThat(BatchrunSerializer.argumentsToJson(arguments))
                .isEqualTo("{\"rent_id\":123,\"dry\":true,\"day\":\"2024-01-01\",\"big\":9999999999}");
    }
}
