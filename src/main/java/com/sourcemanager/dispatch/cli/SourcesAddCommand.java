package com.sourcemanager.dispatch.cli;

import com.sourcemanager.core.store.RegionalSourceStore;
import com.sourcemanager.core.store.SourceRecord;
import com.sourcemanager.core.store.StoreResult;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * CLI command: source-manager sources add --region R [--id I] [--title T] [--type T] [--field k=v]...
 * <p>
 * A new id is generated when {@code --id} is omitted.
 */
@Command(name = "add", mixinStandardHelpOptions = true, description = "Add a source record to a region")
@Component
public class SourcesAddCommand implements Callable<Integer> {

    @Option(names = {"--region", "-r"}, required = true, description = "Region name")
    private String region;

    @Option(names = "--id", description = "Source id (generated when omitted)")
    private String id;

    @Option(names = {"--title", "-t"}, description = "Title")
    private String title;

    @Option(names = "--type", description = "Source type")
    private String sourceType;

    @Option(names = {"--field", "-f"}, description = "Additional field as key=value (repeatable)")
    private Map<String, String> fields = new LinkedHashMap<>();

    private final RegionalSourceStore store;

    public SourcesAddCommand(RegionalSourceStore store) {
        this.store = store;
    }

    @Override
    public Integer call() {
        var record = new SourceRecord();
        if (title != null) {
            record.setField(SourceRecord.TITLE, title);
        }
        if (sourceType != null) {
            record.setField(SourceRecord.SOURCE_TYPE, sourceType);
        }
        if (fields != null) {
            fields.forEach(record::setField);
        }
        if (id != null) {
            record.setId(id);
        }

        StoreResult result = store.addSource(region, record);
        if (result.success()) {
            ConsoleOutput.success(result.message());
            return 0;
        }
        ConsoleOutput.error(result.message());
        return 1;
    }
}
