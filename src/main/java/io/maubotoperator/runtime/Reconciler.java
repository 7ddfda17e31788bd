package io.maubotoperator.runtime;

import io.maubotoperator.config.OperatorConfig;
import io.maubotoperator.config.OperatorSettings;
import io.maubotoperator.model.LayerDefinition;
import io.maubotoperator.model.LayerPlan;
import io.maubotoperator.model.RelationKind;
import io.maubotoperator.model.UnitStatus;
import io.maubotoperator.model.WorkloadConfig;
import io.maubotoperator.relation.CharmState;
import io.maubotoperator.relation.CharmStateSource;
import io.maubotoperator.relation.RelationReadResult;
import io.maubotoperator.relation.RelationReader;
import io.maubotoperator.security.SensitiveDataMasker;
import io.maubotoperator.supervisor.Supervisor;
import io.maubotoperator.workload.ConfigBuildResult;
import io.maubotoperator.workload.ConfigBuilder;
import io.maubotoperator.workload.ConfigRenderer;
import io.maubotoperator.workload.LayerPlanner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

public final class Reconciler {
    public static final UnitStatus INITIAL_STATUS = UnitStatus.waiting("container-not-ready");
    static final List<String> DATA_DIRECTORIES = List.of("/data/plugins", "/data/trash", "/data/dbs");
    static final String APPLY_FAILED_PREFIX = "apply failed: ";

    private static final Logger log = LoggerFactory.getLogger(Reconciler.class);

    private final CharmStateSource stateSource;
    private final Supervisor supervisor;
    private final StatusReporter statusReporter;
    private final RelationReader relationReader;
    private final ConfigBuilder configBuilder;
    private final ConfigRenderer configRenderer;
    private final LayerPlanner layerPlanner;
    private UnitStatus status;
    // Set after an interrupted apply; cleared once every planned service restarted.
    private boolean restartPending;

    public Reconciler(CharmStateSource stateSource, Supervisor supervisor, StatusReporter statusReporter) {
        this(stateSource, supervisor, statusReporter, INITIAL_STATUS);
    }

    /**
     * @param lastStatus status reported by the previous invocation, used to resume an interrupted apply
     */
    public Reconciler(CharmStateSource stateSource, Supervisor supervisor, StatusReporter statusReporter, UnitStatus lastStatus) {
        this(
                stateSource,
                supervisor,
                statusReporter,
                lastStatus,
                new RelationReader(),
                new ConfigBuilder(),
                new ConfigRenderer(),
                new LayerPlanner()
        );
    }

    public Reconciler(
            CharmStateSource stateSource,
            Supervisor supervisor,
            StatusReporter statusReporter,
            UnitStatus lastStatus,
            RelationReader relationReader,
            ConfigBuilder configBuilder,
            ConfigRenderer configRenderer,
            LayerPlanner layerPlanner
    ) {
        this.stateSource = Objects.requireNonNull(stateSource, "stateSource");
        this.supervisor = Objects.requireNonNull(supervisor, "supervisor");
        this.statusReporter = Objects.requireNonNull(statusReporter, "statusReporter");
        this.relationReader = Objects.requireNonNull(relationReader, "relationReader");
        this.configBuilder = Objects.requireNonNull(configBuilder, "configBuilder");
        this.configRenderer = Objects.requireNonNull(configRenderer, "configRenderer");
        this.layerPlanner = Objects.requireNonNull(layerPlanner, "layerPlanner");
        this.status = lastStatus == null ? INITIAL_STATUS : lastStatus;
        this.restartPending = isApplyFailure(status);
    }

    public UnitStatus status() {
        return status;
    }

    public ReconcileOutcome reconcile(String event) {
        ReconcileOutcome outcome = run(event);
        if (!outcome.status().equals(status)) {
            log.info("event={} status {} -> {}", event, status, outcome.status());
        }
        status = outcome.status();
        try {
            statusReporter.report(outcome.status());
        } catch (RuntimeException e) {
            log.error("event={} failed to report status {}", event, outcome.status(), e);
        }
        return outcome;
    }

    static boolean isApplyFailure(UnitStatus status) {
        return status.state() == UnitStatus.State.BLOCKED && status.reason().startsWith(APPLY_FAILED_PREFIX);
    }

    private ReconcileOutcome run(String event) {
        if (!supervisor.canConnect()) {
            log.debug("event={} container {} not reachable yet", event, OperatorConfig.CONTAINER_NAME);
            return ReconcileOutcome.stopped(event, UnitStatus.waiting("container"));
        }
        CharmState state;
        try {
            state = stateSource.load();
        } catch (Exception e) {
            log.error("event={} failed to load charm state", event, e);
            return ReconcileOutcome.stopped(event, UnitStatus.blocked("state unavailable"));
        }
        ReconcileContext context = context(event, state);

        for (RelationReadResult read : context.reads().values()) {
            if (read.isMalformed()) {
                return ReconcileOutcome.stopped(event, UnitStatus.blocked("invalid relation: " + read.kind().label()));
            }
        }

        ConfigBuildResult built = configBuilder.build(context.facts(), context.settings());
        switch (built.verdict()) {
            case NOT_READY:
                stopWorkload(event);
                return ReconcileOutcome.stopped(event, UnitStatus.waiting(built.missing().label()));
            case INVALID:
                return ReconcileOutcome.stopped(event, UnitStatus.blocked("invalid config: " + built.invalidKey()));
            default:
                break;
        }

        // Everything is computed before the first write.
        WorkloadConfig config = built.config();
        LayerPlan plan = layerPlanner.plan(config);
        String rendered = configRenderer.render(config);
        if (log.isDebugEnabled()) {
            log.debug("event={} facts={} planned layers={}", event, context.facts(), SensitiveDataMasker.maskedJson(plan.layers()));
        }
        return apply(event, plan, rendered);
    }

    private void stopWorkload(String event) {
        try {
            supervisor.stop(List.of(LayerPlanner.WORKLOAD_NAME));
        } catch (RuntimeException e) {
            log.error("event={} failed to stop {}", event, LayerPlanner.WORKLOAD_NAME, e);
        }
    }

    ReconcileContext context(String event, CharmState state) {
        OperatorSettings settings = OperatorSettings.fromConfig(state.config());
        Map<RelationKind, RelationReadResult> reads = relationReader.readAll(state);
        return new ReconcileContext(event, state, settings, reads, RelationReader.presentFacts(reads));
    }

    private ReconcileOutcome apply(String event, LayerPlan plan, String rendered) {
        ApplyStep step = ApplyStep.CONFIGURATION;
        boolean configWritten = false;
        boolean layersReplaced = false;
        try {
            Optional<String> current = supervisor.readFile(OperatorConfig.WORKLOAD_CONFIG_PATH);
            boolean configChanged = current.isEmpty() || !current.get().equals(rendered);

            step = ApplyStep.LAYERS;
            Map<String, LayerDefinition> applied = supervisor.appliedLayers();
            List<String> changedLayers = new ArrayList<>();
            for (LayerDefinition layer : plan.layers()) {
                if (!layer.equals(applied.get(layer.name()))) {
                    changedLayers.add(layer.name());
                }
            }

            if (configChanged) {
                step = ApplyStep.CONFIGURATION;
                supervisor.makeDirectories(DATA_DIRECTORIES);
                supervisor.writeFile(OperatorConfig.WORKLOAD_CONFIG_PATH, rendered);
                configWritten = true;
            }
            if (!changedLayers.isEmpty()) {
                step = ApplyStep.LAYERS;
                supervisor.replaceLayers(plan);
                layersReplaced = true;
            }

            step = ApplyStep.SERVICES;
            List<String> restart = new ArrayList<>();
            List<String> start = new ArrayList<>();
            for (LayerDefinition layer : plan.layers()) {
                String name = layer.name();
                boolean affected = restartPending
                        || changedLayers.contains(name)
                        || (configChanged && LayerPlanner.WORKLOAD_NAME.equals(name));
                if (affected) {
                    restart.add(name);
                } else if (!supervisor.isRunning(name)) {
                    start.add(name);
                }
            }
            if (!restart.isEmpty()) {
                supervisor.restart(restart);
            }
            if (!start.isEmpty()) {
                supervisor.start(start);
            }
            restartPending = false;
            if (configWritten || layersReplaced) {
                log.info("event={} applied config={} layers={} restarted={}", event, configWritten, changedLayers, restart);
            }
            return new ReconcileOutcome(event, UnitStatus.active(), configWritten, layersReplaced, restart, start);
        } catch (RuntimeException e) {
            log.error("event={} apply failed during {}", event, step.label(), e);
            restartPending = true;
            return new ReconcileOutcome(
                    event,
                    UnitStatus.blocked(APPLY_FAILED_PREFIX + step.label()),
                    configWritten,
                    layersReplaced,
                    List.of(),
                    List.of()
            );
        }
    }

    enum ApplyStep {
        CONFIGURATION("configuration"),
        LAYERS("layers"),
        SERVICES("services");

        private final String label;

        ApplyStep(String label) {
            this.label = label;
        }

        String label() {
            return label;
        }
    }
}
