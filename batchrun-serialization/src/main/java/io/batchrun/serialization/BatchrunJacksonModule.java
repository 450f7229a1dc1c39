package io.batchrun.serialization;

import com.fasterxml.jackson.databind.module.SimpleModule;
import io.batchrun.core.command.ParameterSpec;
import io.batchrun.core.compactor.EntryData;
import java.io.Serial;

/// Jackson `SimpleModule` that registers the Batchrun type handlers in one place.
///
/// - `EntryData`: `EntryDataSerializer` / `EntryDataDeserializer`, the compact-log
///   metadata in its version 1 layout
/// - `ParameterSpec`: `ParameterSpecSerializer` / `ParameterSpecDeserializer`, one entry of
///   a command parameter schema
///
/// Definition-file records bind through Jackson's record support and need no registration.
///
/// @implNote All registrations are explicit, no classpath scanning.
/// @see BatchrunSerializer for the convenience factory API
public class BatchrunJacksonModule extends SimpleModule {

    @Serial private static final long serialVersionUID = 6620913391765240157L;

    public BatchrunJacksonModule() {
        super("BatchrunJacksonModule");

        addSerializer(EntryData.class, new EntryDataSerializer());
        addDeserializer(EntryData.class, new EntryDataDeserializer());

        addSerializer(ParameterSpec.class, new ParameterSpecSerializer());
        addDeserializer(ParameterSpec.class, new ParameterSpecDeserializer());
    }
}
