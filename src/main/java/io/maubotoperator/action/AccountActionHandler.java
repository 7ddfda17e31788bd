package io.maubotoperator.action;

import io.maubotoperator.api.AdminSession;
import io.maubotoperator.api.MaubotApiClient;
import io.maubotoperator.api.MaubotApiException;
import io.maubotoperator.api.RegisteredAccount;
import io.maubotoperator.config.OperatorSettings;
import io.maubotoperator.model.FederationFact;
import io.maubotoperator.model.RelationKind;
import io.maubotoperator.relation.CharmState;
import io.maubotoperator.relation.CharmStateSource;
import io.maubotoperator.relation.RelationReadResult;
import io.maubotoperator.relation.RelationReader;
import io.maubotoperator.supervisor.Supervisor;
import io.maubotoperator.workload.LayerPlanner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.security.SecureRandom;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * The two account actions. Each performs one login and at most one follow-up call against the maubot API and
 * reports every failure as an {@link ActionResult} instead of throwing.
 */
public final class AccountActionHandler {
    public static final String CREATE_ADMIN = "create-admin";
    public static final String REGISTER_CLIENT_ACCOUNT = "register-client-account";
    static final String ROOT_ADMIN = "root";

    private static final Logger log = LoggerFactory.getLogger(AccountActionHandler.class);
    private static final SecureRandom RANDOM = new SecureRandom();

    private final CharmStateSource stateSource;
    private final Supervisor supervisor;
    private final Function<OperatorSettings, MaubotApiClient> clientFactory;
    private final RelationReader relationReader;
    private final Supplier<String> passwordGenerator;

    public AccountActionHandler(CharmStateSource stateSource, Supervisor supervisor) {
        this(stateSource, supervisor, MaubotApiClient::fromSettings, new RelationReader(), AccountActionHandler::generatePassword);
    }

    public AccountActionHandler(
            CharmStateSource stateSource,
            Supervisor supervisor,
            Function<OperatorSettings, MaubotApiClient> clientFactory,
            RelationReader relationReader,
            Supplier<String> passwordGenerator
    ) {
        this.stateSource = stateSource;
        this.supervisor = supervisor;
        this.clientFactory = clientFactory;
        this.relationReader = relationReader;
        this.passwordGenerator = passwordGenerator;
    }

    public ActionResult createAdmin(String name) {
        if (name == null || name.isBlank()) {
            return ActionResult.fail(CREATE_ADMIN, ActionFailure.PRECONDITION, "name is required");
        }
        String trimmed = name.trim();
        if (ROOT_ADMIN.equals(trimmed)) {
            return ActionResult.fail(CREATE_ADMIN, ActionFailure.PRECONDITION, "root is reserved, please choose a different name");
        }
        if (!workloadReady()) {
            return ActionResult.fail(CREATE_ADMIN, ActionFailure.PRECONDITION, "maubot is not ready");
        }
        CharmState state;
        try {
            state = stateSource.load();
        } catch (Exception e) {
            log.error("action={} failed to load charm state", CREATE_ADMIN, e);
            return ActionResult.fail(CREATE_ADMIN, ActionFailure.PRECONDITION, "charm state unavailable");
        }
        OperatorSettings settings = OperatorSettings.fromConfig(state.config());
        String invalidKey = settings.invalidKey();
        if (invalidKey != null) {
            return ActionResult.fail(CREATE_ADMIN, ActionFailure.PRECONDITION, "invalid config: " + invalidKey);
        }
        if (settings.rootAdminPassword() == null) {
            return ActionResult.fail(CREATE_ADMIN, ActionFailure.AUTHENTICATION, "root admin credentials are not configured");
        }
        MaubotApiClient client = clientFactory.apply(settings);
        AdminSession session;
        try {
            session = client.login(ROOT_ADMIN, settings.rootAdminPassword());
        } catch (MaubotApiException e) {
            return authFailure(CREATE_ADMIN, e);
        }
        String password = passwordGenerator.get();
        try {
            client.createAdmin(session, trimmed, password);
        } catch (MaubotApiException e) {
            return callFailure(CREATE_ADMIN, e);
        }
        log.info("action={} created admin {}", CREATE_ADMIN, trimmed);
        Map<String, String> results = new LinkedHashMap<>();
        results.put("password", password);
        return ActionResult.ok(CREATE_ADMIN, results);
    }

    public ActionResult registerClientAccount(String adminName, String adminPassword, String accountName) {
        if (isBlank(adminName) || isBlank(adminPassword) || isBlank(accountName)) {
            return ActionResult.fail(
                    REGISTER_CLIENT_ACCOUNT,
                    ActionFailure.PRECONDITION,
                    "admin-name, admin-password and account-name are required"
            );
        }
        if (!workloadReady()) {
            return ActionResult.fail(REGISTER_CLIENT_ACCOUNT, ActionFailure.PRECONDITION, "maubot is not ready");
        }
        CharmState state;
        try {
            state = stateSource.load();
        } catch (Exception e) {
            log.error("action={} failed to load charm state", REGISTER_CLIENT_ACCOUNT, e);
            return ActionResult.fail(REGISTER_CLIENT_ACCOUNT, ActionFailure.PRECONDITION, "charm state unavailable");
        }
        RelationReadResult federation = relationReader.read(RelationKind.FEDERATION, state);
        if (!federation.isPresent()) {
            return ActionResult.fail(REGISTER_CLIENT_ACCOUNT, ActionFailure.PRECONDITION, "matrix-auth integration is required");
        }
        FederationFact homeserver = (FederationFact) federation.fact();
        OperatorSettings settings = OperatorSettings.fromConfig(state.config());
        String invalidKey = settings.invalidKey();
        if (invalidKey != null) {
            return ActionResult.fail(REGISTER_CLIENT_ACCOUNT, ActionFailure.PRECONDITION, "invalid config: " + invalidKey);
        }
        MaubotApiClient client = clientFactory.apply(settings);

        AdminSession session;
        try {
            session = client.login(adminName.trim(), adminPassword);
        } catch (MaubotApiException e) {
            return authFailure(REGISTER_CLIENT_ACCOUNT, e);
        }
        String password = passwordGenerator.get();
        RegisteredAccount account;
        try {
            account = client.registerAccount(session, homeserver.homeserverName(), accountName.trim(), password);
        } catch (MaubotApiException e) {
            return callFailure(REGISTER_CLIENT_ACCOUNT, e);
        }
        log.info("action={} registered {} on {}", REGISTER_CLIENT_ACCOUNT, account.userId(), homeserver.homeserverName());
        Map<String, String> results = new LinkedHashMap<>();
        results.put("user-id", account.userId());
        results.put("password", password);
        results.put("access-token", account.accessToken());
        results.put("device-id", account.deviceId());
        return ActionResult.ok(REGISTER_CLIENT_ACCOUNT, results);
    }

    private boolean workloadReady() {
        try {
            return supervisor.canConnect()
                    && supervisor.appliedLayers().containsKey(LayerPlanner.WORKLOAD_NAME)
                    && supervisor.isRunning(LayerPlanner.WORKLOAD_NAME);
        } catch (RuntimeException e) {
            log.warn("workload readiness check failed: {}", e.getMessage());
            return false;
        }
    }

    private static ActionResult authFailure(String action, MaubotApiException e) {
        log.warn("action={} authentication failed: {}", action, e.getMessage());
        return ActionResult.fail(action, ActionFailure.AUTHENTICATION, "error while authenticating with Maubot: " + e.getMessage());
    }

    private static ActionResult callFailure(String action, MaubotApiException e) {
        log.warn("action={} call failed: {}", action, e.getMessage());
        return ActionResult.fail(action, ActionFailure.CALL, "error while interacting with Maubot: " + e.getMessage());
    }

    private static boolean isBlank(String raw) {
        return raw == null || raw.isBlank();
    }

    static String generatePassword() {
        byte[] bytes = new byte[10];
        RANDOM.nextBytes(bytes);
        return Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
    }
}
