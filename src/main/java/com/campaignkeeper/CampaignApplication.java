package com.campaignkeeper;

import com.campaignkeeper.agent.MasterAgent;
import com.campaignkeeper.agent.SceneAgent;
import com.campaignkeeper.collaborator.ImageSceneRenderer;
import com.campaignkeeper.collaborator.LlmNarrationGenerator;
import com.campaignkeeper.collaborator.MediaDispatcher;
import com.campaignkeeper.collaborator.MediaRenderer;
import com.campaignkeeper.collaborator.Narration;
import com.campaignkeeper.collaborator.NarrationGenerator;
import com.campaignkeeper.collaborator.ResponseChannel;
import com.campaignkeeper.config.MemoryConfig;
import com.campaignkeeper.config.ModelsConfig;
import com.campaignkeeper.config.StorageConfig;
import com.campaignkeeper.exception.CampaignException;
import com.campaignkeeper.memory.CharacterCountEstimator;
import com.campaignkeeper.memory.Compressor;
import com.campaignkeeper.memory.ExtractiveSummarizer;
import com.campaignkeeper.memory.LlmSummarizer;
import com.campaignkeeper.memory.Summarizer;
import com.campaignkeeper.model.BeatStatus;
import com.campaignkeeper.model.BeatTransition;
import com.campaignkeeper.model.CampaignPhase;
import com.campaignkeeper.model.CampaignState;
import com.campaignkeeper.model.EntityKind;
import com.campaignkeeper.model.OpenThread;
import com.campaignkeeper.model.SceneRecord;
import com.campaignkeeper.model.StoryBeat;
import com.campaignkeeper.model.WorldEntity;
import com.campaignkeeper.planning.CampaignDesigner;
import com.campaignkeeper.planning.CampaignPlan;
import com.campaignkeeper.planning.LlmCampaignDesigner;
import com.campaignkeeper.planning.PlanningSession;
import com.campaignkeeper.planning.QuestionnaireCampaignDesigner;
import com.campaignkeeper.repository.JsonTranscriptStore;
import com.campaignkeeper.repository.MarkdownCampaignRepository;
import com.campaignkeeper.session.CampaignSession;
import com.campaignkeeper.session.TurnResult;
import dev.langchain4j.model.TokenCountEstimator;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.openai.OpenAiTokenCountEstimator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Scanner;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Command-line game table. Resumes the latest save or runs the planning phase, then plays scenes.
 * Without any API key the campaign runs in scribe mode: the game master types the narration.
 */
public class CampaignApplication {

    private static final Logger log = LoggerFactory.getLogger(CampaignApplication.class);

    private static final String ANSI_RESET = "\u001B[0m";
    private static final String ANSI_USER = "\u001B[38;5;33m";
    private static final String ANSI_MODEL = "\u001B[38;5;214m";
    private static final String ANSI_WARN = "\u001B[38;5;203m";
    private static final int RECAP_SCENES = 3;

    private final Scanner scanner = new Scanner(System.in);
    private final List<ProviderConfig> configs = ModelsConfig.PROVIDERS;
    private final MarkdownCampaignRepository repository;
    private final MasterAgent master;
    private final CampaignSession session;
    private final ExecutorService mediaExecutor = Executors.newFixedThreadPool(2);
    private final ImageSceneRenderer imageRenderer;
    private ProviderConfig currentConfig;

    public CampaignApplication() {
        Clock clock = Clock.systemUTC();
        Path savesDirectory = StorageConfig.getSavesDirectory();
        this.currentConfig = ModelsConfig.defaultProvider().orElse(null);

        Summarizer summarizer;
        TokenCountEstimator estimator;
        if (currentConfig != null) {
            ChatModel summaryModel = ModelFactory.createModel(currentConfig, ModelsConfig.SUMMARY_TEMPERATURE);
            summarizer = new LlmSummarizer(summaryModel);
            estimator = new OpenAiTokenCountEstimator("gpt-4");
        } else {
            summarizer = new ExtractiveSummarizer();
            estimator = new CharacterCountEstimator();
        }

        this.repository = new MarkdownCampaignRepository(savesDirectory, clock);
        Compressor compressor = new Compressor(summarizer, MemoryConfig.fromEnvironment(), clock);
        this.master = new MasterAgent(repository, new JsonTranscriptStore(savesDirectory), compressor, estimator, clock);

        ResponseChannel channel = new ResponseChannel();
        List<MediaRenderer> renderers = new ArrayList<>();
        this.imageRenderer = new ImageSceneRenderer(ModelFactory.createImageModel(ModelsConfig.getOpenAiKey()),
            ModelFactory.defaultImageModel(), mediaExecutor);
        if (imageRenderer.isEnabled()) {
            renderers.add(imageRenderer);
        }
        channel.subscribe(result -> {
            if (!channel.isCurrent(result)) {
                return;
            }
            if (result.succeeded()) {
                System.out.println("\n[" + result.renderer() + "] " + result.payload().location());
            } else {
                System.out.println("\n[" + result.renderer() + " unavailable: " + result.failure() + "]");
            }
        });
        this.session = new CampaignSession(master, repository, createNarrator(),
            new MediaDispatcher(renderers, channel));
    }

    private NarrationGenerator createNarrator() {
        if (currentConfig == null) {
            return (context, playerInput) -> {
                System.out.print(ANSI_MODEL + "Narrator" + ANSI_RESET + " (you)\n");
                return Narration.text(scanner.nextLine().trim());
            };
        }
        return new LlmNarrationGenerator(ModelFactory.createModel(currentConfig, ModelsConfig.NARRATION_TEMPERATURE));
    }

    private CampaignDesigner createDesigner() {
        if (currentConfig == null) {
            return new QuestionnaireCampaignDesigner();
        }
        return new LlmCampaignDesigner(ModelFactory.createModel(currentConfig, ModelsConfig.NARRATION_TEMPERATURE));
    }

    public void run(boolean ignoreSaves) {
        printWelcome();

        CampaignSession.StartupOutcome startup = session.resumeLatest(ignoreSaves);
        if (startup.warning() != null) {
            System.out.println(ANSI_WARN + "Warning: " + startup.warning() + ANSI_RESET);
        }
        if (startup.resumed()) {
            CampaignState state = master.snapshot();
            System.out.println("Resumed '" + state.getName() + "' from " + startup.save().getFileName());
            CampaignPlan.visualStyleOf(state).ifPresent(imageRenderer::setVisualStyle);
            printRecap();
        } else if (!runPlanning()) {
            shutdown();
            return;
        }

        while (true) {
            System.out.print("\n" + ANSI_USER + "You" + ANSI_RESET + "\n");
            if (!scanner.hasNextLine()) {
                break;
            }
            String input = scanner.nextLine().trim();

            if (input.isEmpty()) {
                continue;
            }

            if (input.equalsIgnoreCase("/quit") || input.equalsIgnoreCase("/exit")) {
                break;
            }

            try {
                if (input.startsWith("/")) {
                    if (!handleCommand(input)) {
                        break;
                    }
                } else {
                    handleTurn(input);
                }
            } catch (CampaignException e) {
                System.out.println("[" + e.getErrorCode().getCode() + "] " + e.getMessage());
            }
        }

        if (master.phase() == CampaignPhase.ACTIVE) {
            session.trackSave(master.pause());
        }
        shutdown();
        System.out.println("Goodbye!");
    }

    private boolean runPlanning() {
        System.out.print("\nName your new campaign: ");
        if (!scanner.hasNextLine()) {
            return false;
        }
        String name = scanner.nextLine().trim();
        if (name.isEmpty()) {
            name = "Untitled Campaign";
        }
        PlanningSession planning = new PlanningSession(createDesigner(), master);
        System.out.println("Answer the questions below. Type '" + PlanningSession.DONE + "' when you are ready.");
        Optional<String> question = Optional.of(planning.start(name));
        while (question.isPresent()) {
            System.out.print("\n" + ANSI_MODEL + "Planner" + ANSI_RESET + "\n" + question.get() + "\n> ");
            if (!scanner.hasNextLine()) {
                return false;
            }
            String answer = scanner.nextLine().trim();
            try {
                question = planning.reply(answer);
            } catch (CampaignException e) {
                System.out.println("[" + e.getErrorCode().getCode() + "] " + e.getMessage());
            }
        }
        CampaignPlan plan = planning.plan();
        imageRenderer.setVisualStyle(plan.visualStyle());
        session.trackSave(planning.initialSave());
        System.out.println("\nCampaign '" + plan.title() + "' is ready with " + plan.acts().size() + " story beats.");
        System.out.println("Start a scene with /scene <title>, or just start playing.");
        return true;
    }

    private void printWelcome() {
        System.out.println("===========================================");
        System.out.println("   Campaign Keeper - tabletop campaign CLI");
        System.out.println("===========================================");
        System.out.println();
        printHelp();
        System.out.println();
        System.out.println("Narrator: "
            + (currentConfig == null ? "you (scribe mode)" : currentConfig.getDisplayName()));
    }

    private void printHelp() {
        System.out.println("Commands:");
        System.out.println("  /scene <title>        - Start a new scene");
        System.out.println("  /end                  - Conclude the scene and save");
        System.out.println("  /abort                - Discard the scene without saving it");
        System.out.println("  /beat <n> <status>    - Move story beat n to active or done");
        System.out.println("  /npc Name: text       - Record an NPC (also /location, /item)");
        System.out.println("  /thread <text>        - Open a plot thread");
        System.out.println("  /resolve <text>       - Resolve a plot thread");
        System.out.println("  /status               - Show world state, story plan and threads");
        System.out.println("  /recap                - Show recent scene summaries");
        System.out.println("  /setmodel             - Switch narrator model");
        System.out.println("  /pause                - Save and pause the campaign");
        System.out.println("  /archive              - Mark the campaign complete");
        System.out.println("  /help                 - Show this help");
        System.out.println("  /quit                 - Save and exit");
    }

    /**
     * @return false when the loop should stop
     */
    private boolean handleCommand(String input) {
        String[] parts = input.split("\\s+", 2);
        String command = parts[0].toLowerCase();
        String argument = parts.length > 1 ? parts[1].trim() : "";

        switch (command) {
            case "/scene" -> {
                SceneAgent scene = session.startScene(argument.isEmpty()
                    ? "Scene " + (master.snapshot().getSceneHistory().size() + 1) : argument);
                System.out.println("Scene " + scene.id() + " '" + scene.getTitle() + "' begins.");
            }
            case "/end" -> {
                SceneRecord record = session.concludeScene();
                System.out.println("Scene '" + record.title() + "' concluded: " + record.summary().text());
            }
            case "/abort" -> {
                session.abortScene();
                System.out.println("Scene discarded.");
            }
            case "/beat" -> handleBeat(argument);
            case "/npc" -> recordEntity(EntityKind.NPC, argument);
            case "/location" -> recordEntity(EntityKind.LOCATION, argument);
            case "/item" -> recordEntity(EntityKind.ITEM, argument);
            case "/thread", "/resolve" -> handleThread(command, argument);
            case "/status" -> printStatus();
            case "/recap" -> printRecap();
            case "/setmodel" -> handleSetModel();
            case "/pause" -> {
                session.trackSave(master.pause());
                System.out.println("Campaign saved and paused.");
                return false;
            }
            case "/archive" -> {
                session.trackSave(master.archive());
                System.out.println("Campaign archived. Well played!");
                return false;
            }
            case "/help" -> printHelp();
            default -> System.out.println("Unknown command. Type /help for available commands.");
        }
        return true;
    }

    private void handleTurn(String input) {
        String providerName = currentConfig == null ? "Narrator" : currentConfig.getDisplayName().split(" ")[0];
        if (currentConfig != null) {
            System.out.println();
            System.out.print(ANSI_MODEL + providerName + ANSI_RESET + "\n");
        }
        TurnResult result = session.playerTurn(input);
        if (!result.succeeded()) {
            System.out.println("[Error] " + result.error());
            System.out.println(result.isRetryable()
                ? "Nothing was recorded; send the same input again to retry."
                : "Nothing was recorded.");
            return;
        }
        if (currentConfig != null) {
            System.out.println(result.narration());
        }
        result.warnings().forEach(warning -> System.out.println(ANSI_WARN + warning + ANSI_RESET));
        result.sceneConcluded().ifPresent(record ->
            System.out.println("\n-- Scene '" + record.title() + "' concluded and saved --"));
    }

    private void handleThread(String command, String argument) {
        if (argument.isBlank()) {
            System.out.println("Usage: " + command + " <thread text>");
            return;
        }
        if (command.equals("/thread")) {
            requireScene().openThread(argument);
            System.out.println("Thread opened: " + argument);
        } else {
            requireScene().resolveThread(argument);
            System.out.println("Thread marked resolved: " + argument);
        }
    }

    private void handleBeat(String argument) {
        String[] parts = argument.split("\\s+");
        if (parts.length != 2) {
            System.out.println("Usage: /beat <number> <active|done>");
            return;
        }
        try {
            BeatTransition transition =
                new BeatTransition(Integer.parseInt(parts[0]), BeatStatus.fromLabel(parts[1]));
            requireScene().proposeBeatTransition(transition);
            System.out.println("Beat " + transition.order() + " will become " + transition.target().label()
                + " when the scene ends.");
        } catch (IllegalArgumentException e) {
            System.out.println("Usage: /beat <number> <active|done>");
        }
    }

    private void recordEntity(EntityKind kind, String argument) {
        if (argument.isEmpty()) {
            System.out.println("Usage: /" + kind.name().toLowerCase() + " Name: description");
            return;
        }
        int separator = argument.indexOf(':');
        WorldEntity entity = separator > 0
            ? new WorldEntity(argument.substring(0, separator), argument.substring(separator + 1))
            : new WorldEntity(argument, "");
        requireScene().recordEntity(kind, entity);
        System.out.println("Recorded " + entity.name() + ".");
    }

    private SceneAgent requireScene() {
        SceneAgent scene = master.liveScene();
        if (scene == null) {
            scene = session.startScene("Scene " + (master.snapshot().getSceneHistory().size() + 1));
            System.out.println("Scene " + scene.id() + " '" + scene.getTitle() + "' begins.");
        }
        return scene;
    }

    private void printStatus() {
        CampaignState state = master.snapshot();
        System.out.println("Campaign: " + state.getName() + " (" + master.phase() + ")");
        for (EntityKind kind : EntityKind.values()) {
            List<WorldEntity> entities = state.getWorldState().entities(kind);
            System.out.println(kind.heading() + ": " + (entities.isEmpty() ? "-" : ""));
            entities.forEach(entity -> System.out.println("  " + entity.name() + " - " + entity.description()));
        }
        System.out.println("Story plan:");
        for (StoryBeat beat : state.getStoryPlan().beats()) {
            System.out.println("  " + beat.order() + ". [" + beat.status().label() + "] " + beat.description());
        }
        System.out.println("Threads:");
        for (OpenThread thread : state.getOpenThreads()) {
            System.out.println("  [" + (thread.resolved() ? "x" : " ") + "] " + thread.text());
        }
        SceneAgent scene = master.liveScene();
        if (scene != null) {
            System.out.println("Live scene: " + scene.getTitle() + " (" + scene.transcript().size()
                + " turns, ~" + scene.contextCost() + " tokens in context)");
        }
    }

    private void printRecap() {
        CampaignState state = master.snapshot();
        CampaignPlan.synopsisOf(state).ifPresent(synopsis -> System.out.println(synopsis));
        List<SceneRecord> history = state.getSceneHistory();
        if (history.isEmpty()) {
            System.out.println("No scenes played yet.");
        } else {
            System.out.println("Campaign so far: " + master.produceSummary().text());
        }
        for (SceneRecord record : history.subList(Math.max(0, history.size() - RECAP_SCENES), history.size())) {
            System.out.println("- " + record.title() + ": " + record.summary().text());
        }
        state.getStoryPlan().activeBeat()
            .ifPresent(beat -> System.out.println("Current beat: " + beat.description()));
    }

    private void handleSetModel() {
        System.out.println("\nAvailable models:");
        for (int i = 0; i < configs.size(); i++) {
            ProviderConfig config = configs.get(i);
            String marker = config.equals(currentConfig) ? " [current]" : "";
            String missing = config.isConfigured() ? "" : " (no API key)";
            System.out.println("  " + (i + 1) + ". " + config.getDisplayName() + marker + missing);
        }

        System.out.print("\nSelect model (1-" + configs.size() + "): ");
        String choice = scanner.nextLine().trim();

        try {
            int index = Integer.parseInt(choice) - 1;
            if (index >= 0 && index < configs.size() && configs.get(index).isConfigured()) {
                currentConfig = configs.get(index);
                session.setNarrator(createNarrator());
                System.out.println("Switched to: " + currentConfig.getDisplayName());
                System.out.println("(Campaign and scene history preserved)");
            } else {
                System.out.println("Invalid selection. Please choose a configured model 1-" + configs.size());
            }
        } catch (NumberFormatException e) {
            System.out.println("Invalid input. Please enter a number.");
        }
    }

    private void shutdown() {
        try {
            session.lastSave().get(30, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (ExecutionException | TimeoutException e) {
            log.error("Final save did not complete", e);
            System.out.println(ANSI_WARN + "Warning: the last save may not have completed: " + e.getMessage()
                + ANSI_RESET);
        }
        repository.close();
        mediaExecutor.shutdownNow();
        scanner.close();
    }

    public static void main(String[] args) {
        boolean ignoreSaves = List.of(args).contains("--new");
        CampaignApplication app = new CampaignApplication();
        app.run(ignoreSaves);
    }
}
