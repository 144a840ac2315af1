package work.forge.scaffold.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import picocli.CommandLine;
import work.forge.scaffold.api.ForgeGenerator;
import work.forge.scaffold.config.ConfigurationLoader;
import work.forge.scaffold.runtime.GenerationStep;

@CommandLine.Command(
    name = "plan",
    description = "Print the ordered steps a generation would run. Writes nothing.",
    mixinStandardHelpOptions = true,
    versionProvider = VersionProvider.class
)
final class PlanCommand extends ProjectCommand {
    private static final ObjectWriter JSON_WRITER = new ObjectMapper().writerWithDefaultPrettyPrinter();

    @CommandLine.Parameters(index = "0", arity = "0..1", defaultValue = ".", description = "Project directory.")
    private Path path;

    @Override
    int run() throws Exception {
        var config = ConfigurationLoader.load(path);
        var plan = new ForgeGenerator().plan(config);
        var out = spec.commandLine().getOut();
        if (common.json) {
            List<Map<String, Object>> steps = new ArrayList<>();
            for (GenerationStep step : plan.steps()) {
                var entry = new LinkedHashMap<String, Object>();
                entry.put("id", step.id());
                entry.put("category", step.category().name().toLowerCase(Locale.ROOT));
                entry.put("priority", step.priority());
                entry.put("requires", List.copyOf(step.requires()));
                entry.put("description", step.description());
                steps.add(entry);
            }
            out.println(JSON_WRITER.writeValueAsString(steps));
            return 0;
        }
        int position = 1;
        for (GenerationStep step : plan.steps()) {
            out.printf("%3d  %-22s %-10s %s%n", position++, step.id(), step.category(), step.description());
        }
        out.printf("%d step(s) for '%s'%n", plan.size(), config.projectName());
        return 0;
    }
}
