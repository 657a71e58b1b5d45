package com.sourcemanager.dispatch.cli;

import com.sourcemanager.core.store.RegionalSourceStore;
import com.sourcemanager.core.store.SourcePatch;
import com.sourcemanager.core.store.StoreResult;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * CLI command: source-manager sources update --region R --id I [field options]
 * <p>
 * Only the given fields change; everything else on the record is kept.
 */
@Command(name = "update", mixinStandardHelpOptions = true, description = "Update fields of a source record")
@Component
public class SourcesUpdateCommand implements Callable<Integer> {

    @Option(names = {"--region", "-r"}, required = true, description = "Region name")
    private String region;

    @Option(names = "--id", required = true, description = "Id of the source to update")
    private String id;

    @Option(names = {"--title", "-t"}, description = "Title")
    private String title;

    @Option(names = "--type", description = "Source type")
    private String sourceType;

    @Option(names = "--authors", split = ",", description = "Comma-separated authors")
    private List<String> authors;

    @Option(names = "--year", description = "Publication year")
    private Integer year;

    @Option(names = "--publisher", description = "Publisher")
    private String publisher;

    @Option(names = "--url", description = "URL")
    private String url;

    @Option(names = "--citation", description = "Formatted citation")
    private String citation;

    @Option(names = "--description", description = "Description")
    private String description;

    @Option(names = {"--field", "-f"}, description = "Additional field as key=value (repeatable)")
    private Map<String, String> fields = new LinkedHashMap<>();

    private final RegionalSourceStore store;

    public SourcesUpdateCommand(RegionalSourceStore store) {
        this.store = store;
    }

    @Override
    public Integer call() {
        SourcePatch patch;
        try {
            var builder = SourcePatch.builder()
                    .title(title)
                    .sourceType(sourceType)
                    .authors(authors)
                    .year(year)
                    .publisher(publisher)
                    .url(url)
                    .citation(citation)
                    .description(description);
            if (fields != null) {
                fields.forEach(builder::field);
            }
            patch = builder.build();
        } catch (IllegalArgumentException e) {
            ConsoleOutput.error(e.getMessage());
            return 2;
        }

        StoreResult result = store.updateSource(region, id, patch);
        if (result.success()) {
            ConsoleOutput.success(result.message());
            return 0;
        }
        ConsoleOutput.error(result.message());
        return 1;
    }
}
