package im.arun.hoteltree.cli;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import im.arun.hoteltree.autosave.ExecutorTaskTimer;
import im.arun.hoteltree.autosave.SaveStatus;
import im.arun.hoteltree.config.ConfigLoader;
import im.arun.hoteltree.config.HotelTreeConfig;
import im.arun.hoteltree.json.NodeCodec;
import im.arun.hoteltree.llm.ArchitectService;
import im.arun.hoteltree.llm.OpenAIClient;
import im.arun.hoteltree.model.ApplyOutcome;
import im.arun.hoteltree.model.ArchitectResponse;
import im.arun.hoteltree.model.ContentNode;
import im.arun.hoteltree.model.HealthIssue;
import im.arun.hoteltree.model.HotelSummary;
import im.arun.hoteltree.model.HotelTemplate;
import im.arun.hoteltree.model.IssueSeverity;
import im.arun.hoteltree.model.StructuralAction;
import im.arun.hoteltree.model.TreeStats;
import im.arun.hoteltree.session.HotelSession;
import im.arun.hoteltree.store.FirestoreRestStore;
import im.arun.hoteltree.sync.FileLocalCache;
import im.arun.hoteltree.sync.ShardSyncGateway;
import im.arun.hoteltree.tree.ActionApplier;
import im.arun.hoteltree.tree.TemplateImporter;
import im.arun.hoteltree.tree.TreeExporter;
import im.arun.hoteltree.tree.TreeStore;
import im.arun.hoteltree.tree.TreeValidator;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;

/**
 * Command-line interface for HotelTree using Picocli.
 */
@Command(
    name = "hoteltree",
    description = "Browse, validate and restructure hotel knowledge bases stored in Firestore",
    mixinStandardHelpOptions = true,
    version = "HotelTree 1.0",
    subcommands = {
        HotelTreeCLI.ListCommand.class,
        HotelTreeCLI.ShowCommand.class,
        HotelTreeCLI.SearchCommand.class,
        HotelTreeCLI.ExportCommand.class,
        HotelTreeCLI.ValidateCommand.class,
        HotelTreeCLI.CreateCommand.class,
        HotelTreeCLI.TemplateCommand.class,
        HotelTreeCLI.AnalyzeCommand.class,
        HotelTreeCLI.ArchitectCommand.class
    }
)
public class HotelTreeCLI implements Callable<Integer> {

    @Option(names = {"--config"}, description = "Path to a YAML configuration file")
    private String configPath;

    @Option(names = {"--project-id"}, description = "Firestore project id")
    private String projectId;

    @Option(names = {"--api-key"}, description = "Firestore web API key (or set FIRESTORE_API_KEY env var)")
    private String apiKey;

    @Option(names = {"--cache-dir"}, description = "Directory for the offline cache")
    private String cacheDir;

    private final NodeCodec codec = new NodeCodec();
    private HotelTreeConfig config;

    @Override
    public Integer call() {
        new CommandLine(this).usage(System.out);
        return 0;
    }

    HotelTreeConfig config() {
        if (config == null) {
            Map<String, Object> overrides = new HashMap<>();
            overrides.put("projectId", projectId);
            overrides.put("apiKey", apiKey);
            overrides.put("cacheDir", cacheDir);
            config = new ConfigLoader(configPath).load(overrides);
        }
        return config;
    }

    ShardSyncGateway gateway() {
        HotelTreeConfig cfg = config();
        FirestoreRestStore store = new FirestoreRestStore(cfg.getFirestoreBaseUrl(), cfg.getProjectId(),
                cfg.getDatabaseId(), cfg.getApiKey(), cfg.getAccessToken());
        FileLocalCache cache = new FileLocalCache(Paths.get(cfg.getCacheDir()), cfg.getCacheKeyPrefix(), codec);
        return new ShardSyncGateway(store, cache, codec, cfg.getHotelsCollection(), cfg.getShardCollection(),
                cfg.getTemplatesCollection());
    }

    ArchitectService architect() {
        HotelTreeConfig cfg = config();
        OpenAIClient client = new OpenAIClient(cfg.getLlmApiKey(), cfg.getLlmBaseUrl(), 5, 1000);
        return new ArchitectService(client, new TreeExporter(codec), cfg.getModel(), cfg.getMaxContextTokens());
    }

    Optional<ContentNode> loadHotel(String hotelId) {
        Optional<ContentNode> tree = gateway().load(hotelId);
        if (tree.isEmpty()) {
            System.err.println("Error: hotel not found: " + hotelId);
        }
        return tree;
    }

    NodeCodec codec() {
        return codec;
    }

    @Command(name = "list", description = "List all hotels")
    static class ListCommand implements Callable<Integer> {
        @ParentCommand
        private HotelTreeCLI parent;

        @Override
        public Integer call() {
            List<HotelSummary> hotels = parent.gateway().list();
            if (hotels.isEmpty()) {
                System.out.println("No hotels found.");
            }
            for (HotelSummary hotel : hotels) {
                System.out.printf("%-40s %s%n", hotel.getId(), hotel.getName());
            }
            return 0;
        }
    }

    @Command(name = "show", description = "Print a hotel's outline and statistics")
    static class ShowCommand implements Callable<Integer> {
        @ParentCommand
        private HotelTreeCLI parent;

        @Parameters(index = "0", description = "Hotel id")
        private String hotelId;

        @Override
        public Integer call() {
            Optional<ContentNode> tree = parent.loadHotel(hotelId);
            if (tree.isEmpty()) {
                return 1;
            }
            TreeStats stats = TreeStore.stats(tree.get());
            System.out.println(new TreeExporter(parent.codec()).toAiText(tree.get()));
            System.out.println();
            System.out.println("=".repeat(50));
            System.out.printf("Nodes: %d  Depth: %d  Categories: %d%n", stats.getTotalNodes(), stats.getDepth(), stats.getCategories());
            System.out.printf("Completion: %d%% (%d of %d items empty)%n", stats.getCompletionRate(),
                    stats.getEmptyFieldCount(), stats.getFillableItems());
            return 0;
        }
    }

    @Command(name = "search", description = "Show only the branches matching a query")
    static class SearchCommand implements Callable<Integer> {
        @ParentCommand
        private HotelTreeCLI parent;

        @Parameters(index = "0", description = "Hotel id")
        private String hotelId;

        @Parameters(index = "1", description = "Text to look for in names, values and tags")
        private String query;

        @Override
        public Integer call() {
            Optional<ContentNode> tree = parent.loadHotel(hotelId);
            if (tree.isEmpty()) {
                return 1;
            }
            Optional<ContentNode> matches = TreeStore.filter(tree.get(), query);
            if (matches.isEmpty()) {
                System.out.println("No matches for '" + query + "'.");
                return 0;
            }
            System.out.println(new TreeExporter(parent.codec()).toAiText(matches.get()));
            return 0;
        }
    }

    enum ExportFormat { JSON, TEXT, CSV }

    @Command(name = "export", description = "Export a hotel as clean JSON, a text outline or a CSV sheet")
    static class ExportCommand implements Callable<Integer> {
        @ParentCommand
        private HotelTreeCLI parent;

        @Parameters(index = "0", description = "Hotel id")
        private String hotelId;

        @Option(names = {"--format"}, description = "json, text or csv", defaultValue = "json")
        private ExportFormat format;

        @Option(names = {"--output"}, description = "Output file path")
        private String outputPath;

        @Override
        public Integer call() throws Exception {
            Optional<ContentNode> tree = parent.loadHotel(hotelId);
            if (tree.isEmpty()) {
                return 1;
            }
            TreeExporter exporter = new TreeExporter(parent.codec());
            String output;
            if (format == ExportFormat.JSON) {
                ObjectMapper mapper = new ObjectMapper();
                mapper.enable(SerializationFeature.INDENT_OUTPUT);
                output = mapper.writeValueAsString(exporter.toCleanJson(tree.get()));
            } else if (format == ExportFormat.CSV) {
                output = exporter.toCsv(tree.get());
            } else {
                output = exporter.toAiText(tree.get());
            }

            if (outputPath != null) {
                // spreadsheet apps need the BOM to detect UTF-8
                Files.writeString(Paths.get(outputPath), format == ExportFormat.CSV ? "\uFEFF" + output : output);
                System.out.println("Output written to: " + outputPath);
            } else {
                System.out.println(output);
            }
            return 0;
        }
    }

    @Command(name = "validate", description = "Run the data health checks; exits with 2 when critical issues exist")
    static class ValidateCommand implements Callable<Integer> {
        @ParentCommand
        private HotelTreeCLI parent;

        @Parameters(index = "0", description = "Hotel id")
        private String hotelId;

        @Override
        public Integer call() {
            Optional<ContentNode> tree = parent.loadHotel(hotelId);
            if (tree.isEmpty()) {
                return 1;
            }
            List<HealthIssue> issues = new TreeValidator().validate(tree.get());
            if (issues.isEmpty()) {
                System.out.println("No issues found.");
                return 0;
            }
            boolean critical = false;
            for (HealthIssue issue : issues) {
                System.out.printf("[%s] %s (%s): %s%n", issue.getSeverity(), issue.getNodeName(), issue.getNodeId(), issue.getMessage());
                if (issue.getFix() != null) {
                    System.out.println("    fix: " + issue.getFix().getDescription());
                }
                critical |= issue.getSeverity() == IssueSeverity.CRITICAL;
            }
            System.out.println(issues.size() + " issue(s) found.");
            return critical ? 2 : 0;
        }
    }

    @Command(name = "create", description = "Create a new hotel, optionally from a template file or a stored template")
    static class CreateCommand implements Callable<Integer> {
        @ParentCommand
        private HotelTreeCLI parent;

        @Parameters(index = "0", description = "Hotel name")
        private String name;

        @Option(names = {"--template"}, description = "Template JSON file")
        private String templatePath;

        @Option(names = {"--template-id"}, description = "Id of a stored template (see 'template list')")
        private String templateId;

        @Option(names = {"--structure-only"}, description = "Drop all values from the template")
        private boolean structureOnly;

        @Override
        public Integer call() throws Exception {
            if (templatePath != null && templateId != null) {
                System.err.println("Error: use either --template or --template-id");
                return 1;
            }
            ContentNode initial;
            if (templateId != null) {
                Optional<HotelTemplate> template = parent.gateway().findTemplate(templateId);
                if (template.isEmpty()) {
                    System.err.println("Error: template not found: " + templateId);
                    return 1;
                }
                initial = new TemplateImporter().instantiate(template.get(), name, structureOnly);
            } else if (templatePath != null) {
                Path path = Paths.get(templatePath);
                if (!Files.exists(path)) {
                    System.err.println("Error: template file not found: " + templatePath);
                    return 1;
                }
                JsonNode json = parent.codec().getObjectMapper().readTree(path.toFile());
                HotelTemplate template = parent.codec().decodeTemplate(json);
                initial = new TemplateImporter().instantiate(template, name, structureOnly);
            } else {
                initial = TemplateImporter.initialTree(name);
            }
            ContentNode created = parent.gateway().create(initial);
            System.out.println("Created hotel " + created.getId() + " (" + name + ")");
            return 0;
        }
    }

    @Command(name = "template", description = "Save, list and delete reusable hotel templates",
            subcommands = {
                TemplateCommand.SaveTemplateCommand.class,
                TemplateCommand.ListTemplatesCommand.class,
                TemplateCommand.DeleteTemplateCommand.class
            })
    static class TemplateCommand implements Callable<Integer> {
        @ParentCommand
        private HotelTreeCLI parent;

        @Override
        public Integer call() {
            new CommandLine(this).usage(System.out);
            return 0;
        }

        @Command(name = "save", description = "Store a hotel's tree as a template")
        static class SaveTemplateCommand implements Callable<Integer> {
            @ParentCommand
            private TemplateCommand group;

            @Parameters(index = "0", description = "Hotel id")
            private String hotelId;

            @Parameters(index = "1", description = "Template name")
            private String name;

            @Option(names = {"--description"}, description = "What the template is for", defaultValue = "")
            private String description;

            @Option(names = {"--structure-only"}, description = "Keep names and shape, drop all values")
            private boolean structureOnly;

            @Override
            public Integer call() {
                Optional<ContentNode> tree = group.parent.loadHotel(hotelId);
                if (tree.isEmpty()) {
                    return 1;
                }
                HotelTemplate template = group.parent.gateway().saveTemplate(name, description, tree.get(), structureOnly);
                System.out.println("Saved template " + template.getId() + " (" + name + ")");
                return 0;
            }
        }

        @Command(name = "list", description = "List stored templates")
        static class ListTemplatesCommand implements Callable<Integer> {
            @ParentCommand
            private TemplateCommand group;

            @Override
            public Integer call() {
                List<HotelTemplate> templates = group.parent.gateway().listTemplates();
                if (templates.isEmpty()) {
                    System.out.println("No templates found.");
                }
                for (HotelTemplate template : templates) {
                    System.out.printf("%-40s %-30s %s%n", template.getId(), template.getName(),
                            template.getDescription() != null ? template.getDescription() : "");
                }
                return 0;
            }
        }

        @Command(name = "delete", description = "Delete a stored template")
        static class DeleteTemplateCommand implements Callable<Integer> {
            @ParentCommand
            private TemplateCommand group;

            @Parameters(index = "0", description = "Template id")
            private String templateId;

            @Override
            public Integer call() {
                group.parent.gateway().deleteTemplate(templateId);
                System.out.println("Deleted template " + templateId);
                return 0;
            }
        }
    }

    @Command(name = "analyze", description = "Ask the AI analyst for a summary of a hotel's offerings")
    static class AnalyzeCommand implements Callable<Integer> {
        @ParentCommand
        private HotelTreeCLI parent;

        @Parameters(index = "0", description = "Hotel id")
        private String hotelId;

        @Option(names = {"--audit"}, description = "Audit the structure instead of summarising content")
        private boolean audit;

        @Override
        public Integer call() {
            Optional<ContentNode> tree = parent.loadHotel(hotelId);
            if (tree.isEmpty()) {
                return 1;
            }
            ArchitectService service = parent.architect();
            System.out.println(audit ? service.audit(tree.get()) : service.analyze(tree.get()));
            return 0;
        }
    }

    @Command(name = "architect", description = "Let the AI architect propose (and optionally apply) structural edits")
    static class ArchitectCommand implements Callable<Integer> {
        @ParentCommand
        private HotelTreeCLI parent;

        @Parameters(index = "0", description = "Hotel id")
        private String hotelId;

        @Parameters(index = "1..*", arity = "1..*", description = "What to change, in plain language")
        private List<String> command;

        @Option(names = {"--apply"}, description = "Apply the proposed actions and save")
        private boolean apply;

        @Override
        public Integer call() {
            HotelTreeConfig cfg = parent.config();
            try (ExecutorTaskTimer timer = new ExecutorTaskTimer();
                 HotelSession session = new HotelSession(parent.gateway(), new ActionApplier(parent.codec()), timer,
                         Duration.ofMillis(cfg.getDebounceMillis()), Duration.ofMillis(cfg.getSavedHoldMillis()))) {
                if (!session.open(hotelId)) {
                    System.err.println("Error: hotel not found: " + hotelId);
                    return 1;
                }
                String request = String.join(" ", command);
                ArchitectResponse response = parent.architect().proposeActions(session.getTree(), request);
                System.out.println(response.getSummary());
                for (StructuralAction action : response.getActions()) {
                    System.out.printf("  %-6s %-30s %s%n", action.getType(), action.getTargetId(),
                            action.getReason() != null ? action.getReason() : "");
                }
                if (!apply || response.getActions().isEmpty()) {
                    return 0;
                }

                ApplyOutcome outcome = session.applyActions(response.getActions());
                outcome.getFailures().forEach(failure -> System.err.println("  " + failure));
                SaveStatus status = session.saveNow().join();
                System.out.printf("Applied %d of %d actions; save %s%n", outcome.getApplied(),
                        response.getActions().size(), status == SaveStatus.ERROR ? "kept in local cache" : "complete");
                return outcome.getFailures().isEmpty() ? 0 : 2;
            }
        }
    }

    public static void main(String[] args) {
        CommandLine commandLine = new CommandLine(new HotelTreeCLI())
                .setCaseInsensitiveEnumValuesAllowed(true);
        commandLine.setExecutionExceptionHandler((ex, cmd, parseResult) -> {
            cmd.getErr().println("Error: " + ex.getMessage());
            return 1;
        });
        int exitCode = commandLine.execute(args);
        System.exit(exitCode);
    }
}
