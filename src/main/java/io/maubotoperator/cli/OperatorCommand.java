package io.maubotoperator.cli;

import io.maubotoperator.action.AccountActionHandler;
import io.maubotoperator.action.ActionResult;
import io.maubotoperator.config.OperatorConfig;
import io.maubotoperator.config.OperatorSettings;
import io.maubotoperator.model.LayerPlan;
import io.maubotoperator.model.RelationKind;
import io.maubotoperator.model.UnitStatus;
import io.maubotoperator.relation.CharmState;
import io.maubotoperator.relation.CharmStateSource;
import io.maubotoperator.relation.JsonCharmState;
import io.maubotoperator.relation.RelationReadResult;
import io.maubotoperator.relation.RelationReader;
import io.maubotoperator.runtime.EventDispatcher;
import io.maubotoperator.runtime.FileStatusReporter;
import io.maubotoperator.runtime.ReconcileOutcome;
import io.maubotoperator.runtime.Reconciler;
import io.maubotoperator.security.SensitiveDataMasker;
import io.maubotoperator.supervisor.LocalDirectorySupervisor;
import io.maubotoperator.supervisor.Supervisor;
import io.maubotoperator.util.Jsons;
import io.maubotoperator.workload.ConfigBuildResult;
import io.maubotoperator.workload.ConfigBuilder;
import io.maubotoperator.workload.ConfigRenderer;
import io.maubotoperator.workload.LayerPlanner;
import io.maubotoperator.workload.ProbeScrapeJob;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;

@Command(
        name = "maubot-operator",
        mixinStandardHelpOptions = true,
        description = "Maubot operator hook and action entry point",
        subcommands = {
                OperatorCommand.HookCommand.class,
                OperatorCommand.CreateAdminCommand.class,
                OperatorCommand.RegisterClientAccountCommand.class,
                OperatorCommand.PlanCommand.class,
                OperatorCommand.StatusCommand.class
        }
)
public final class OperatorCommand implements Runnable {
    private static final Logger log = LoggerFactory.getLogger(OperatorCommand.class);

    @Option(names = {"--state-dir"}, description = "Directory holding state.json and status.json", defaultValue = "state")
    String stateDir;

    @Option(names = {"--container-root"}, description = "Directory mirroring the workload container", defaultValue = "container")
    String containerRoot;

    @Override
    public void run() {
        System.out.println("Use subcommands: hook | create-admin | register-client-account | plan | status");
    }

    OperatorConfig config() {
        return OperatorConfig.fromRoots(stateDir, containerRoot);
    }

    EventDispatcher dispatcher() {
        OperatorConfig config = config();
        CharmStateSource stateSource = () -> JsonCharmState.load(config.stateFile());
        Supervisor supervisor = new LocalDirectorySupervisor(config);
        FileStatusReporter statusReporter = new FileStatusReporter(config.statusFile());
        Reconciler reconciler = new Reconciler(stateSource, supervisor, statusReporter, lastStatus(statusReporter));
        return new EventDispatcher(reconciler, new AccountActionHandler(stateSource, supervisor));
    }

    private static UnitStatus lastStatus(FileStatusReporter statusReporter) {
        try {
            return statusReporter.read().orElse(Reconciler.INITIAL_STATUS);
        } catch (RuntimeException e) {
            log.warn("ignoring unreadable status file: {}", e.getMessage());
            return Reconciler.INITIAL_STATUS;
        }
    }

    static int printAction(ActionResult result) {
        System.out.println(Jsons.toJson(result.output()));
        return result.success() ? 0 : 1;
    }

    @Command(name = "hook", description = "Reconcile in response to a lifecycle or relation hook")
    static final class HookCommand implements Callable<Integer> {
        @ParentCommand
        OperatorCommand parent;

        @Parameters(index = "0", description = "Hook name, e.g. config-changed")
        String hook;

        @Override
        public Integer call() {
            ReconcileOutcome outcome = parent.dispatcher().dispatchHook(hook);
            Map<String, Object> out = new LinkedHashMap<>();
            out.put("event", outcome.event());
            out.put("status", outcome.status().toString());
            out.put("config_written", outcome.configWritten());
            out.put("layers_replaced", outcome.layersReplaced());
            out.put("restarted", outcome.servicesRestarted());
            out.put("started", outcome.servicesStarted());
            System.out.println(Jsons.toJson(out));
            return 0;
        }
    }

    @Command(name = "create-admin", description = "Create a maubot admin account")
    static final class CreateAdminCommand implements Callable<Integer> {
        @ParentCommand
        OperatorCommand parent;

        @Option(names = {"--name"}, required = true, description = "Admin account name")
        String name;

        @Override
        public Integer call() {
            return printAction(parent.dispatcher().dispatchAction(
                    AccountActionHandler.CREATE_ADMIN,
                    Map.of("name", name)
            ));
        }
    }

    @Command(name = "register-client-account", description = "Register a Matrix account through maubot")
    static final class RegisterClientAccountCommand implements Callable<Integer> {
        @ParentCommand
        OperatorCommand parent;

        @Option(names = {"--admin-name"}, required = true, description = "Maubot admin name")
        String adminName;

        @Option(names = {"--admin-password"}, required = true, description = "Maubot admin password")
        String adminPassword;

        @Option(names = {"--account-name"}, required = true, description = "Account to register on the homeserver")
        String accountName;

        @Override
        public Integer call() {
            Map<String, String> params = new LinkedHashMap<>();
            params.put("admin-name", adminName);
            params.put("admin-password", adminPassword);
            params.put("account-name", accountName);
            return printAction(parent.dispatcher().dispatchAction(AccountActionHandler.REGISTER_CLIENT_ACCOUNT, params));
        }
    }

    @Command(name = "plan", description = "Print the configuration and layers the next reconciliation would apply")
    static final class PlanCommand implements Callable<Integer> {
        @ParentCommand
        OperatorCommand parent;

        @Override
        public Integer call() throws Exception {
            CharmState state = JsonCharmState.load(parent.config().stateFile());
            Map<RelationKind, RelationReadResult> reads = new RelationReader().readAll(state);
            Map<String, Object> out = new LinkedHashMap<>();
            Map<String, String> relations = new LinkedHashMap<>();
            reads.forEach((kind, read) -> relations.put(kind.relationName(), read.outcome().name().toLowerCase(Locale.ROOT)));
            out.put("relations", relations);
            ConfigBuildResult built = new ConfigBuilder().build(
                    RelationReader.presentFacts(reads),
                    OperatorSettings.fromConfig(state.config())
            );
            out.put("verdict", built.verdict().name().toLowerCase(Locale.ROOT));
            if (built.isReady()) {
                LayerPlan plan = new LayerPlanner().plan(built.config());
                out.put("config", Jsons.yamlMapper().readTree(new ConfigRenderer().render(built.config())));
                out.put("layers", plan.layers());
            }
            out.put("scrape_jobs", ProbeScrapeJob.jobs(state.unitName(), state.appName(), state.modelName()));
            System.out.println(Jsons.toJson(SensitiveDataMasker.masked(Jsons.mapper().valueToTree(out))));
            return built.isReady() ? 0 : 1;
        }
    }

    @Command(name = "status", description = "Print the last reported unit status")
    static final class StatusCommand implements Callable<Integer> {
        @ParentCommand
        OperatorCommand parent;

        @Override
        public Integer call() {
            Optional<UnitStatus> status = new FileStatusReporter(parent.config().statusFile()).read();
            System.out.println(status.orElse(Reconciler.INITIAL_STATUS));
            return 0;
        }
    }
}
