package org.kleis.verify.solvers.isabelle;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import lombok.Getter;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.tuple.Pair;
import org.kleis.verify.ast.Expression;
import org.kleis.verify.ast.TypeExpr;
import org.kleis.verify.config.KleisConfig;
import org.kleis.verify.solvers.SatisfiabilityResult;
import org.kleis.verify.solvers.SolverBackend;
import org.kleis.verify.solvers.SolverException;
import org.kleis.verify.solvers.VerificationResult;
import org.kleis.verify.solvers.capabilities.CapabilityLoader;
import org.kleis.verify.solvers.capabilities.SolverCapabilities;
import org.kleis.verify.structures.DataDef;
import org.kleis.verify.structures.TypeParam;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * 基于 Isabelle 服务器的 {@link SolverBackend}。
 * <p>
 * 每个证明目标写成一个临时理论 {@code Kleis_Verify_<n>.thy}：导入 Complex_Main 和伴随理论，
 * 已加载的公理以 axiomatization 形式放在目标引理之前，引理用 {@code by auto} 证明，
 * 然后通过 use_theories 命令提交并轮询结果。
 * <p>
 * Isabelle 没有增量断言栈，push/pop 只在本地维护上下文公理列表的深度。
 * 不支持具体求值；可满足性通过证明否定得到，因此只能给出 Unsatisfiable 的确定回答。
 * @author Ayalyt
 */
public class IsabelleBackend implements SolverBackend {

    private static final Logger logger = LoggerFactory.getLogger(IsabelleBackend.class);

    static final String THEORY_PREFIX = "Kleis_Verify_";
    private static final Duration POLL_READ_TIMEOUT = Duration.ofSeconds(5);
    private static final Duration COMPANION_TIMEOUT = Duration.ofSeconds(180);

    private final KleisConfig config;
    private final SolverCapabilities capabilities;
    private final IsarTranslator translator = new IsarTranslator();

    private IsabelleConnection connection;
    private Process serverProcess;
    @Getter
    private String sessionId;
    private String sessionName;

    private final Set<String> loadedStructures = new LinkedHashSet<>();
    // 单位元名 -> HOL 类型，写成 consts 声明
    private final Map<String, String> identityElements = new LinkedHashMap<>();
    private final Set<String> constructors = new LinkedHashSet<>();
    private final Set<String> dataTypeNames = new LinkedHashSet<>();
    // 函数名 -> HOL definition 文本
    private final Map<String, String> definedFunctions = new LinkedHashMap<>();
    // 已翻译的上下文公理（Isar 文本）和数据类型声明
    private final List<String> contextAxioms = new ArrayList<>();
    private final List<String> dataTypeDeclarations = new ArrayList<>();
    private final Deque<ScopeFrame> scopes = new ArrayDeque<>();
    private final Map<String, VerificationResult> cache = new HashMap<>();
    private long theoryCounter = 0;

    private final List<Path> companionTheories = new ArrayList<>();
    private final Set<String> companionProven = new LinkedHashSet<>();
    private boolean companionLoaded = false;

    public IsabelleBackend() {
        this(KleisConfig.load());
    }

    public IsabelleBackend(KleisConfig config) {
        this.config = Objects.requireNonNull(config, "IsabelleBackend-构造函数: config 不能为 null");
        this.capabilities = CapabilityLoader.load(CapabilityLoader.ISABELLE_MANIFEST);
        this.sessionName = config.getIsabelleSession();
        logger.info("创建 Isabelle 后端: {}", capabilities);
    }

    @Override
    public String name() {
        return "Isabelle";
    }

    @Override
    public SolverCapabilities capabilities() {
        return capabilities;
    }

    // --- 服务器与会话 ---

    public void connect(String host, int port, String password) {
        if (connection != null) {
            connection.close();
        }
        connection = IsabelleConnection.connect(host, port, password);
    }

    /**
     * 启动 {@code isabelle server} 子进程，从首行读取端口和口令后连接。
     */
    public void startServer() {
        ProcessBuilder builder = new ProcessBuilder(config.getIsabelleExecutable(), "server")
                .redirectError(ProcessBuilder.Redirect.DISCARD);
        String firstLine;
        try {
            serverProcess = builder.start();
            BufferedReader reader = new BufferedReader(
                    new InputStreamReader(serverProcess.getInputStream(), StandardCharsets.UTF_8));
            firstLine = reader.readLine();
        } catch (IOException e) {
            throw new SolverException(SolverException.Kind.CONNECTION,
                    "Failed to start Isabelle server '" + config.getIsabelleExecutable() + "': " + e.getMessage(), e);
        }
        if (firstLine == null) {
            stopServerProcess();
            throw new SolverException(SolverException.Kind.PROTOCOL, "No output from Isabelle server");
        }
        IsabelleServerLine server = IsabelleServerLine.parse(firstLine);
        logger.info("Isabelle 服务器已启动: {}", server);
        String host = StringUtils.defaultIfBlank(config.getIsabelleHost(), server.getHost());
        connect(host, server.getPort(), server.getPassword());
    }

    public void startSession(String session) {
        requireConnected();
        JsonObject args = new JsonObject();
        args.addProperty("session", session);
        JsonArray printMode = new JsonArray();
        printMode.add("symbols");
        args.add("print_mode", printMode);
        connection.setReadTimeout(config.getIsabelleSessionStartTimeout());
        IsabelleMessage reply = connection.sendCommand("session_start", args);
        String id = switch (reply.getKind()) {
            case OK -> {
                String task = reply.taskId();
                if (task != null) {
                    yield IsabelleMessage.stringField(
                            waitForTask(task, config.getIsabelleSessionStartTimeout()), "session_id");
                }
                yield reply.getString("session_id");
            }
            case RUNNING -> IsabelleMessage.stringField(
                    waitForTask(reply.taskId(), config.getIsabelleSessionStartTimeout()), "session_id");
            case ERROR -> throw new SolverException(SolverException.Kind.CONNECTION,
                    "Failed to start session " + session + ": " + reply.text());
            default -> throw new SolverException(SolverException.Kind.PROTOCOL,
                    "Unexpected session_start reply: " + reply);
        };
        if (id == null) {
            throw new SolverException(SolverException.Kind.PROTOCOL, "session_start completed but no session_id returned");
        }
        sessionId = id;
        sessionName = session;
        logger.info("Isabelle 会话 {} 已启动: {}", session, id);
    }

    public void ensureSession() {
        if (!hasSession()) {
            startSession(sessionName);
        }
    }

    public void stopSession() {
        if (connection != null && connection.isAuthenticated() && sessionId != null) {
            JsonObject args = new JsonObject();
            args.addProperty("session_id", sessionId);
            try {
                connection.sendCommand("session_stop", args);
            } catch (SolverException e) {
                logger.warn("停止会话 {} 失败: {}", sessionId, e.getMessage());
            }
        }
        sessionId = null;
    }

    public boolean isConnected() {
        return connection != null && connection.isAuthenticated();
    }

    public boolean hasSession() {
        return sessionId != null;
    }

    private void requireConnected() {
        if (!isConnected()) {
            throw new SolverException(SolverException.Kind.CONNECTION,
                    "Not connected to Isabelle server. Call connect() or startServer() first.");
        }
    }

    /**
     * 等待异步任务的 FINISHED 消息，期间收集 NOTE 中的证明错误。
     * 超过期限时发送 cancel 并抛出 Kind.TIMEOUT。
     * @throws SolverException 任务 FAILED（Kind.PROOF_FAILED）。
     */
    private JsonObject waitForTask(String taskId, Duration timeout) {
        long deadline = System.nanoTime() + timeout.toNanos();
        connection.setReadTimeout(POLL_READ_TIMEOUT);
        String proofError = null;
        while (true) {
            if (System.nanoTime() > deadline) {
                JsonObject cancel = new JsonObject();
                cancel.addProperty("task", taskId);
                try {
                    connection.sendCommand("cancel", cancel);
                } catch (SolverException e) {
                    logger.warn("取消任务 {} 失败: {}", taskId, e.getMessage());
                }
                throw new SolverException(SolverException.Kind.TIMEOUT,
                        "Isabelle task " + taskId + " timed out after " + timeout.getSeconds() + "s");
            }
            IsabelleMessage message = connection.readMessage();
            if (message == null) {
                continue;
            }
            String msgTask = message.getString("task");
            if (msgTask != null && !msgTask.equals(taskId)) {
                continue;
            }
            switch (message.getKind()) {
                case FINISHED -> {
                    JsonObject result = message.asObject();
                    if (proofError != null) {
                        result.addProperty(IsabelleResults.PROOF_ERROR, proofError);
                    }
                    return result;
                }
                case FAILED -> throw new SolverException(SolverException.Kind.PROOF_FAILED,
                        StringUtils.defaultIfBlank(message.getString("message"), "Task failed"));
                case NOTE -> {
                    String text = message.getString("message");
                    if (proofError == null && text != null && IsabelleResults.isProofFailureNote(text)) {
                        proofError = text;
                    }
                    logger.debug("NOTE {}", StringUtils.abbreviate(message.toString(), 300));
                }
                default -> logger.debug("忽略消息 {}", message.getKind());
            }
        }
    }

    /**
     * 提交 use_theories 并分类结果。
     */
    private VerificationResult useTheories(String theoryName, Path masterDir, Duration timeout) {
        JsonObject args = new JsonObject();
        args.addProperty("session_id", sessionId);
        JsonArray theories = new JsonArray();
        theories.add(theoryName);
        args.add("theories", theories);
        args.addProperty("master_dir", masterDir.toAbsolutePath().toString());
        connection.setReadTimeout(config.getIsabelleCommandTimeout());
        IsabelleMessage reply = connection.sendCommand("use_theories", args);
        try {
            return switch (reply.getKind()) {
                case OK -> {
                    String task = reply.taskId();
                    if (task != null) {
                        yield IsabelleResults.fromFinished(waitForTask(task, timeout));
                    }
                    yield reply.isObject() ? IsabelleResults.fromStatus(reply.asObject())
                            : VerificationResult.unknown("Empty use_theories reply");
                }
                case RUNNING -> IsabelleResults.fromFinished(waitForTask(reply.taskId(), timeout));
                case ERROR -> IsabelleResults.fromError(reply.text());
                default -> VerificationResult.unknown("Unexpected use_theories reply: " + reply);
            };
        } catch (SolverException e) {
            return switch (e.getKind()) {
                case TIMEOUT -> VerificationResult.unknown(e.getMessage());
                case PROOF_FAILED -> IsabelleResults.fromError(e.getMessage());
                default -> throw e;
            };
        }
    }

    // --- 证明 ---

    @Override
    public VerificationResult verifyAxiom(Expression axiom) {
        Objects.requireNonNull(axiom, "IsabelleBackend-verifyAxiom: axiom 不能为 null");
        requireConnected();
        ensureSession();
        String isar = translator.translate(axiom);
        VerificationResult cached = cache.get(isar);
        if (cached != null) {
            logger.debug("命中缓存: {}", isar);
            return cached;
        }
        theoryCounter++;
        String theoryName = THEORY_PREFIX + theoryCounter;
        String theory = buildTheoryFor(theoryName, isar);
        logger.debug("提交理论:\n{}", theory);
        VerificationResult result = runScratchTheory(theoryName, theory);
        cache.put(isar, result);
        logger.info("Isabelle 验证 {}: {}", axiom, result);
        return result;
    }

    /**
     * 用当前会话记录生成提交理论：数据类型、单位元 consts、函数 definition、上下文公理和待证引理。
     */
    String buildTheoryFor(String theoryName, String isar) {
        List<String> imports = new ArrayList<>();
        imports.add("Complex_Main");
        for (Path companion : companionTheories) {
            imports.add(StringUtils.removeEnd(companion.getFileName().toString(), ".thy"));
        }
        List<String> declarations = new ArrayList<>(dataTypeDeclarations);
        // 伴随理论提供定义时不再公理化上下文
        if (!companionProven.isEmpty()) {
            return buildTheory(theoryName, imports, declarations, List.of(), isar);
        }
        for (Map.Entry<String, String> identity : identityElements.entrySet()) {
            declarations.add("consts " + identity.getKey() + " :: \"" + identity.getValue() + "\"");
        }
        declarations.addAll(definedFunctions.values());
        return buildTheory(theoryName, imports, declarations, contextAxioms, isar);
    }

    static String buildTheory(String theoryName, List<String> imports, List<String> declarations,
                              List<String> contextAxioms, String isar) {
        StringBuilder sb = new StringBuilder();
        sb.append("theory ").append(theoryName).append('\n');
        sb.append("imports ").append(String.join(" ", imports)).append('\n');
        sb.append("begin\n");
        for (String declaration : declarations) {
            sb.append(declaration).append('\n');
        }
        if (!contextAxioms.isEmpty()) {
            sb.append("\n(* Context axioms *)\n");
            for (int i = 0; i < contextAxioms.size(); i++) {
                sb.append("axiomatization where ctx_").append(i).append(": \"")
                        .append(contextAxioms.get(i)).append("\"\n");
            }
        }
        sb.append("\nlemma kleis_axiom: \"").append(isar).append("\"\n");
        sb.append("  by auto\n");
        sb.append("end\n");
        return sb.toString();
    }

    /**
     * 在临时目录中写入理论和伴随理论副本，提交后删除整个目录。
     */
    private VerificationResult runScratchTheory(String theoryName, String theory) {
        Path dir = null;
        try {
            dir = createScratchDirectory();
            for (Path companion : companionTheories) {
                Files.copy(companion, dir.resolve(companion.getFileName()), StandardCopyOption.REPLACE_EXISTING);
            }
            Files.writeString(dir.resolve(theoryName + ".thy"), theory, StandardCharsets.UTF_8);
            return useTheories(theoryName, dir, config.getIsabelleTheoryTimeout());
        } catch (IOException e) {
            throw new SolverException(SolverException.Kind.INTERNAL,
                    "Failed to write theory " + theoryName + ": " + e.getMessage(), e);
        } finally {
            if (dir != null) {
                deleteRecursively(dir);
            }
        }
    }

    private Path createScratchDirectory() throws IOException {
        String base = config.getIsabelleTheoryDir();
        if (base.isEmpty()) {
            return Files.createTempDirectory("kleis_theories");
        }
        Path root = Paths.get(base);
        Files.createDirectories(root);
        return Files.createTempDirectory(root, "kleis_theories");
    }

    private static void deleteRecursively(Path dir) {
        try (Stream<Path> walk = Files.walk(dir)) {
            for (Path p : walk.sorted(Comparator.reverseOrder()).collect(Collectors.toList())) {
                Files.deleteIfExists(p);
            }
        } catch (IOException e) {
            logger.warn("删除临时理论目录 {} 失败: {}", dir, e.getMessage());
        }
    }

    /**
     * 证明否定：否定成立则不可满足，否定不成立只说明可能可满足。
     */
    @Override
    public SatisfiabilityResult checkSatisfiability(Expression expression) {
        VerificationResult negated = verifyAxiom(Expression.op("not", expression));
        return switch (negated.getKind()) {
            case VALID -> SatisfiabilityResult.unsatisfiable();
            case INVALID -> SatisfiabilityResult.satisfiable(negated.getWitness());
            case UNKNOWN -> SatisfiabilityResult.unknown(negated.getReason());
        };
    }

    @Override
    public Expression evaluate(Expression expression) {
        throw new SolverException(SolverException.Kind.UNSUPPORTED,
                "Isabelle does not support concrete evaluation. Use Z3 for evaluation.");
    }

    /**
     * 不调用 Isabelle 的化简器，原样返回。
     */
    @Override
    public Expression simplify(Expression expression) {
        return expression;
    }

    @Override
    public boolean areEquivalent(Expression left, Expression right) {
        VerificationResult result = verifyAxiom(Expression.eq(left, right));
        if (result.isUnknown()) {
            throw new SolverException(SolverException.Kind.TIMEOUT,
                    "Equivalence of " + left + " and " + right + " is undecided: " + result.getReason());
        }
        return result.isValid();
    }

    // --- 上下文 ---

    @Override
    public void loadStructureAxioms(String structureName, List<Pair<String, Expression>> axioms) {
        if (loadedStructures.contains(structureName)) {
            return;
        }
        List<String> translated = new ArrayList<>(axioms.size());
        for (Pair<String, Expression> axiom : axioms) {
            translated.add(translator.translate(axiom.getRight()));
        }
        contextAxioms.addAll(translated);
        loadedStructures.add(structureName);
        cache.clear();
        logger.info("加载结构 {} 的 {} 条公理", structureName, translated.size());
    }

    @Override
    public boolean isStructureLoaded(String structureName) {
        return loadedStructures.contains(structureName);
    }

    @Override
    public int loadedStructureCount() {
        return loadedStructures.size();
    }

    @Override
    public void push() {
        scopes.push(new ScopeFrame(contextAxioms.size(), new LinkedHashSet<>(loadedStructures),
                new LinkedHashMap<>(identityElements), new LinkedHashMap<>(definedFunctions)));
    }

    @Override
    public void pop(int levels) {
        if (levels < 0 || levels > scopes.size()) {
            throw new IllegalArgumentException("IsabelleBackend-pop: cannot pop " + levels
                    + " level(s) at depth " + scopes.size());
        }
        if (levels == 0) {
            return;
        }
        ScopeFrame frame = null;
        for (int i = 0; i < levels; i++) {
            frame = scopes.pop();
        }
        contextAxioms.subList(frame.axiomCount, contextAxioms.size()).clear();
        loadedStructures.clear();
        loadedStructures.addAll(frame.loadedStructures);
        identityElements.clear();
        identityElements.putAll(frame.identityElements);
        definedFunctions.clear();
        definedFunctions.putAll(frame.definedFunctions);
        cache.clear();
    }

    @Override
    public int scopeDepth() {
        return scopes.size();
    }

    /**
     * 清空会话记录。Isabelle 会话本身保持运行。
     */
    @Override
    public void reset() {
        loadedStructures.clear();
        identityElements.clear();
        constructors.clear();
        dataTypeNames.clear();
        definedFunctions.clear();
        contextAxioms.clear();
        dataTypeDeclarations.clear();
        scopes.clear();
        cache.clear();
        theoryCounter = 0;
        companionTheories.clear();
        companionProven.clear();
        companionLoaded = false;
    }

    @Override
    public void loadIdentityElement(String name, TypeExpr type) {
        Objects.requireNonNull(name, "IsabelleBackend-loadIdentityElement: name 不能为 null");
        if (identityElements.containsKey(name)) {
            logger.debug("单位元 {} 已声明，跳过", name);
            return;
        }
        String holType = holTypeOf(type);
        // 与同类型的已有单位元两两不同
        for (Map.Entry<String, String> other : identityElements.entrySet()) {
            if (other.getValue().equals(holType)) {
                contextAxioms.add("(" + other.getKey() + " ≠ " + name + ")");
            }
        }
        identityElements.put(name, holType);
        cache.clear();
        logger.debug("声明单位元 {} :: {}", name, holType);
    }

    /**
     * 单位元的 HOL 类型。类型变量、函数类型和无法识别的载体类型按 int 处理。
     */
    String holTypeOf(TypeExpr type) {
        if (type == null) {
            return "int";
        }
        return switch (type.getKind()) {
            case NAMED, PARAMETRIC -> {
                String hol = translator.translateType(type.toString());
                yield isKnownHolType(hol) ? hol : "int";
            }
            case FOR_ALL -> holTypeOf(((TypeExpr.ForAll) type).getBody());
            case VAR, FUNCTION, PRODUCT -> "int";
        };
    }

    private boolean isKnownHolType(String hol) {
        if (dataTypeNames.contains(hol)) {
            return true;
        }
        String base = StringUtils.removeEnd(StringUtils.removeEnd(StringUtils.removeEnd(hol, " list"), " option"), " set");
        return switch (base) {
            case "nat", "int", "real", "complex", "rat", "bool", "string", "unit" -> true;
            default -> false;
        };
    }

    @Override
    public boolean isDeclaredConstructor(String name) {
        return constructors.contains(name);
    }

    /**
     * 数据类型写成 HOL {@code datatype} 声明，放在每个提交理论的开头。
     */
    @Override
    public void declareDataTypes(List<DataDef> dataTypes) {
        for (DataDef def : dataTypes) {
            dataTypeDeclarations.add(datatypeDeclaration(def));
            if (def.getTypeParams().isEmpty()) {
                dataTypeNames.add(def.getName());
            }
            for (DataDef.Variant variant : def.getVariants()) {
                constructors.add(variant.getName());
            }
        }
        cache.clear();
    }

    String datatypeDeclaration(DataDef def) {
        Set<String> params = def.getTypeParams().stream().map(TypeParam::getName).collect(Collectors.toSet());
        String head = def.getTypeParams().stream().map(p -> "'" + p.getName() + " ").collect(Collectors.joining())
                + def.getName();
        List<String> variants = new ArrayList<>();
        for (DataDef.Variant variant : def.getVariants()) {
            StringBuilder sb = new StringBuilder(variant.getName());
            for (DataDef.Field field : variant.getFields()) {
                String type = field.getType().toString();
                sb.append(" \"").append(params.contains(type) ? "'" + type : translator.translateType(type)).append('"');
            }
            variants.add(sb.toString());
        }
        return "datatype " + head + " = " + String.join(" | ", variants);
    }

    @Override
    public void assertExpression(Expression expression) {
        contextAxioms.add(translator.translate(expression));
        cache.clear();
    }

    /**
     * 函数写成 HOL {@code definition}，类型由 Isabelle 推断。
     */
    @Override
    public void defineFunction(String name, List<String> params, Expression body) {
        String application = params.isEmpty() ? name : name + " " + String.join(" ", params);
        definedFunctions.put(name, "definition " + name + " where \"" + application + " = "
                + translator.translate(body) + "\"");
        cache.clear();
    }

    /**
     * 尝试从上下文公理推出 False。推不出时不能断定一致，返回 Unknown。
     */
    @Override
    public SatisfiabilityResult checkConsistency() {
        VerificationResult result = verifyAxiom(Expression.object("False"));
        return result.isValid() ? SatisfiabilityResult.unsatisfiable()
                : SatisfiabilityResult.unknown("Isabelle could not derive False from the context axioms");
    }

    @Override
    public int declaredOperationCount() {
        return definedFunctions.size() + constructors.size();
    }

    // --- 伴随理论 ---

    /**
     * 登记源文件的 .thy 伴随理论（如果存在）。
     */
    public void setCompanionTheory(Path kleisFile) {
        Path thy = CompanionTheory.companionOf(kleisFile);
        if (thy != null && !companionTheories.contains(thy)) {
            logger.info("发现伴随理论: {}", thy);
            companionTheories.add(thy);
        }
    }

    /**
     * 登记被导入文件的伴随理论，排在已有伴随理论之前。
     */
    public void addImportCompanion(Path importFile) {
        Path thy = CompanionTheory.companionOf(importFile);
        if (thy != null && !companionTheories.contains(thy)) {
            logger.info("发现导入的伴随理论: {}", thy);
            companionTheories.add(0, thy);
        }
    }

    /**
     * 用 Isabelle 校验每个伴随理论，校验通过的理论中不含 sorry 的引理计入已证明集合。只执行一次。
     */
    public void loadCompanionTheories() {
        if (companionLoaded || companionTheories.isEmpty()) {
            return;
        }
        for (Path thy : companionTheories) {
            CompanionTheory companion = CompanionTheory.read(thy);
            if (!companion.getSorryLemmas().isEmpty()) {
                logger.warn("伴随理论 {} 有 {} 条未证明的引理 (sorry): {}", thy,
                        companion.getSorryLemmas().size(), String.join(", ", companion.getSorryLemmas()));
            }
            if (!isConnected() || !hasSession()) {
                logger.warn("没有 Isabelle 会话，伴随理论 {} 未校验，其引理不被采信", thy);
                continue;
            }
            VerificationResult result = useTheories(companion.theoryName(), thy.toAbsolutePath().getParent(),
                    COMPANION_TIMEOUT);
            if (result.isValid()) {
                companionProven.addAll(companion.getProvenLemmas());
                logger.info("伴随理论 {} 校验通过，证明了: {}", thy, companion.getProvenLemmas());
            } else {
                logger.warn("伴随理论 {} 校验失败，其引理不被采信: {}", thy, result);
            }
        }
        companionLoaded = true;
        cache.clear();
    }

    public boolean isProvenByCompanion(String axiomName) {
        return companionProven.contains(axiomName);
    }

    // --- 关闭 ---

    @Override
    public void close() {
        stopSession();
        if (connection != null) {
            if (connection.isAuthenticated()) {
                try {
                    connection.sendCommand("shutdown", new JsonObject());
                } catch (SolverException e) {
                    logger.debug("发送 shutdown 失败: {}", e.getMessage());
                }
            }
            connection.close();
            connection = null;
        }
        stopServerProcess();
    }

    private void stopServerProcess() {
        if (serverProcess == null) {
            return;
        }
        serverProcess.descendants().forEach(ProcessHandle::destroy);
        serverProcess.destroy();
        try {
            if (!serverProcess.waitFor(2, TimeUnit.SECONDS)) {
                serverProcess.descendants().forEach(ProcessHandle::destroyForcibly);
                serverProcess.destroyForcibly();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            serverProcess.destroyForcibly();
        }
        serverProcess = null;
        logger.info("Isabelle 服务器进程已停止");
    }

    private static final class ScopeFrame {

        private final int axiomCount;
        private final Set<String> loadedStructures;
        private final Map<String, String> identityElements;
        private final Map<String, String> definedFunctions;

        private ScopeFrame(int axiomCount, Set<String> loadedStructures,
                           Map<String, String> identityElements, Map<String, String> definedFunctions) {
            this.axiomCount = axiomCount;
            this.loadedStructures = loadedStructures;
            this.identityElements = identityElements;
            this.definedFunctions = definedFunctions;
        }
    }
}
