package org.kleis.verify.solvers.z3;

import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.Constructor;
import com.microsoft.z3.Context;
import com.microsoft.z3.DatatypeSort;
import com.microsoft.z3.Expr;
import com.microsoft.z3.FuncDecl;
import com.microsoft.z3.Sort;
import lombok.Getter;
import org.kleis.verify.ast.TypeExpr;
import org.kleis.verify.solvers.TranslationException;
import org.kleis.verify.structures.DataDef;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

/**
 * 管理 Kleis 名字到 Z3 声明的映射：单位元常量、未解释函数、代数数据类型及其构造子。
 * 每个后端实例持有一个，不在实例之间共享。
 * @author Ayalyt
 */
@Getter
public class Z3DeclarationManager {

    private static final Logger logger = LoggerFactory.getLogger(Z3DeclarationManager.class);

    private final Context ctx;
    // 类型别名解析，由注册表提供；没有注册表时总是返回 null
    private final Function<String, TypeExpr> aliasResolver;

    private final Map<String, Expr<?>> identityElements = new LinkedHashMap<>();
    private final Map<String, FuncDecl<?>> functions = new LinkedHashMap<>();
    private final Map<String, DatatypeSort<?>> dataTypeSorts = new LinkedHashMap<>();
    // 构造子名 -> (数据类型名, 构造子序号)
    private final Map<String, ConstructorRef> constructors = new LinkedHashMap<>();

    public Z3DeclarationManager(Context ctx, Function<String, TypeExpr> aliasResolver) {
        this.ctx = ctx;
        this.aliasResolver = aliasResolver == null ? name -> null : aliasResolver;
    }

    // --- 类型映射 ---

    /**
     * 将类型名映射为 Z3 Sort：已声明数据类型 → 类型别名 → 内置类型 → Int。
     * 类型变量（M、G、R 等）统一映射为 Int，保证同一载体类型的所有项处于同一 Sort。
     */
    public Sort sortForName(String name) {
        DatatypeSort<?> dt = dataTypeSorts.get(name);
        if (dt != null) {
            return dt;
        }
        TypeExpr alias = aliasResolver.apply(name);
        if (alias != null && !name.equals(alias.headName())) {
            return sortFor(alias);
        }
        Sort builtin = builtinSort(name);
        return builtin != null ? builtin : ctx.getIntSort();
    }

    /**
     * @return 内置类型名对应的 Sort，未知名字返回 null。
     */
    public Sort builtinSort(String name) {
        return switch (name) {
            case "Bool", "Boolean" -> ctx.getBoolSort();
            case "ℝ", "Real", "Scalar", "ℚ", "Rational", "Q" -> ctx.getRealSort();
            case "ℤ", "Int", "Integer", "Z", "ℕ", "Nat", "Natural" -> ctx.getIntSort();
            case "String", "Str" -> ctx.getStringSort();
            default -> null;
        };
    }

    public Sort sortFor(TypeExpr type) {
        return switch (type.getKind()) {
            case NAMED, VAR, PARAMETRIC -> sortForName(type.headName());
            case FOR_ALL -> sortFor(((TypeExpr.ForAll) type).getBody());
            case FUNCTION, PRODUCT -> ctx.getIntSort();
        };
    }

    public boolean isDataTypeSort(Sort sort) {
        return sort instanceof DatatypeSort<?> && dataTypeSorts.containsValue(sort);
    }

    // --- 单位元 ---

    /**
     * 声明单位元常量，返回需要断言的互异约束（与所有同 Sort 的已有单位元两两不同）。
     * @return 互异约束；没有同 Sort 的已有单位元时返回 null。
     */
    public BoolExpr declareIdentity(String name, Sort sort) {
        Expr<?> existing = identityElements.get(name);
        if (existing != null) {
            logger.debug("单位元 {} 已声明，跳过", name);
            return null;
        }
        Expr<?> constant = ctx.mkConst(name, sort);
        List<Expr<?>> sameSort = new ArrayList<>();
        for (Expr<?> other : identityElements.values()) {
            if (other.getSort().equals(sort)) {
                sameSort.add(other);
            }
        }
        identityElements.put(name, constant);
        logger.info("声明单位元: {} : {}", name, sort);
        if (sameSort.isEmpty()) {
            return null;
        }
        sameSort.add(constant);
        return ctx.mkDistinct(sameSort.toArray(new Expr<?>[0]));
    }

    public Expr<?> getIdentity(String name) {
        return identityElements.get(name);
    }

    // --- 未解释函数 ---

    /**
     * 获取或声明函数。同名函数已声明时复用；参数个数不一致视为翻译错误。
     */
    public FuncDecl<?> getOrDeclareFunction(String name, Sort[] domain, Sort range) {
        FuncDecl<?> existing = functions.get(name);
        if (existing != null) {
            if (existing.getDomainSize() != domain.length) {
                throw TranslationException.arity(name, existing.getDomainSize(), domain.length);
            }
            return existing;
        }
        FuncDecl<?> decl = ctx.mkFuncDecl(name, domain, range);
        functions.put(name, decl);
        logger.debug("声明未解释函数: {} : {} → {}", name, Arrays.toString(domain), range);
        return decl;
    }

    public FuncDecl<?> getFunction(String name) {
        return functions.get(name);
    }

    // --- 代数数据类型 ---

    /**
     * 按依赖顺序声明数据类型。自引用类型直接声明；互相递归的一组类型一起声明。
     */
    public void declareDataTypes(List<DataDef> defs) {
        Map<String, DataDef> pending = new LinkedHashMap<>();
        for (DataDef def : defs) {
            if (!dataTypeSorts.containsKey(def.getName())) {
                pending.put(def.getName(), def);
            }
        }
        while (!pending.isEmpty()) {
            DataDef ready = null;
            for (DataDef def : pending.values()) {
                Set<String> deps = dependencies(def, pending.keySet());
                deps.remove(def.getName());
                if (deps.isEmpty()) {
                    ready = def;
                    break;
                }
            }
            if (ready != null) {
                declareGroup(List.of(ready));
                pending.remove(ready.getName());
            } else {
                // 剩余的类型互相递归
                List<DataDef> group = new ArrayList<>(pending.values());
                declareGroup(group);
                pending.clear();
            }
        }
    }

    private Set<String> dependencies(DataDef def, Set<String> candidates) {
        Set<String> deps = new HashSet<>();
        for (DataDef.Variant variant : def.getVariants()) {
            for (DataDef.Field field : variant.getFields()) {
                String head = field.getType().headName();
                if (head != null && candidates.contains(head)) {
                    deps.add(head);
                }
            }
        }
        return deps;
    }

    private void declareGroup(List<DataDef> group) {
        Map<String, Integer> indexInGroup = new HashMap<>();
        for (int i = 0; i < group.size(); i++) {
            indexInGroup.put(group.get(i).getName(), i);
        }
        Constructor<Object>[][] allConstructors = new Constructor[group.size()][];
        for (int g = 0; g < group.size(); g++) {
            DataDef def = group.get(g);
            List<DataDef.Variant> variants = def.getVariants();
            Constructor<Object>[] cons = new Constructor[variants.size()];
            for (int v = 0; v < variants.size(); v++) {
                DataDef.Variant variant = variants.get(v);
                int n = variant.getFields().size();
                String[] fieldNames = new String[n];
                Sort[] sorts = new Sort[n];
                int[] sortRefs = new int[n];
                for (int f = 0; f < n; f++) {
                    DataDef.Field field = variant.getFields().get(f);
                    // 同一构造子的字段名在 Z3 中必须全局唯一
                    fieldNames[f] = field.getName() != null
                            ? variant.getName() + "_" + field.getName()
                            : variant.getName() + "_field_" + f;
                    String head = field.getType().headName();
                    Integer ref = head == null ? null : indexInGroup.get(head);
                    if (ref != null) {
                        sorts[f] = null;
                        sortRefs[f] = ref;
                    } else {
                        sorts[f] = sortFor(field.getType());
                        sortRefs[f] = 0;
                    }
                }
                cons[v] = ctx.mkConstructor(variant.getName(), "is_" + variant.getName(), fieldNames, sorts, sortRefs);
            }
            allConstructors[g] = cons;
        }

        DatatypeSort<Object>[] sorts;
        if (group.size() == 1) {
            sorts = new DatatypeSort[]{ctx.mkDatatypeSort(group.get(0).getName(), allConstructors[0])};
        } else {
            String[] names = group.stream().map(DataDef::getName).toArray(String[]::new);
            sorts = ctx.mkDatatypeSorts(names, allConstructors);
        }
        for (int g = 0; g < group.size(); g++) {
            DataDef def = group.get(g);
            dataTypeSorts.put(def.getName(), sorts[g]);
            for (int v = 0; v < def.getVariants().size(); v++) {
                DataDef.Variant variant = def.getVariants().get(v);
                constructors.put(variant.getName(), new ConstructorRef(def.getName(), v, variant.getFields().size()));
            }
            logger.info("声明数据类型: {} ({} 个构造子)", def.getName(), def.getVariants().size());
        }
    }

    public boolean isConstructor(String name) {
        return constructors.containsKey(name);
    }

    public ConstructorRef getConstructorRef(String name) {
        return constructors.get(name);
    }

    public FuncDecl<?> constructorDecl(ConstructorRef ref) {
        return dataTypeSorts.get(ref.getDataType()).getConstructors()[ref.getIndex()];
    }

    public FuncDecl<?> testerDecl(ConstructorRef ref) {
        return dataTypeSorts.get(ref.getDataType()).getRecognizers()[ref.getIndex()];
    }

    public FuncDecl<?>[] accessorDecls(ConstructorRef ref) {
        if (ref.getArity() == 0) {
            return new FuncDecl<?>[0];
        }
        return dataTypeSorts.get(ref.getDataType()).getAccessors()[ref.getIndex()];
    }

    /**
     * @return 无参构造子对应的 Z3 值，不是无参构造子时返回 null。
     */
    public Expr<?> nullaryConstructor(String name) {
        ConstructorRef ref = constructors.get(name);
        if (ref == null || ref.getArity() != 0) {
            return null;
        }
        return ctx.mkApp(constructorDecl(ref));
    }

    /**
     * @return 某数据类型 Sort 的构造子名，按声明顺序。
     */
    public List<String> constructorNames(String dataType) {
        List<String> names = new ArrayList<>();
        for (Map.Entry<String, ConstructorRef> entry : constructors.entrySet()) {
            if (entry.getValue().getDataType().equals(dataType)) {
                names.add(entry.getKey());
            }
        }
        return names;
    }

    /**
     * @return 与 Sort 对应的数据类型名，不是已声明数据类型时返回 null。
     */
    public String dataTypeNameOf(Sort sort) {
        for (Map.Entry<String, DatatypeSort<?>> entry : dataTypeSorts.entrySet()) {
            if (entry.getValue().equals(sort)) {
                return entry.getKey();
            }
        }
        return null;
    }

    // --- 作用域快照 ---

    public Snapshot snapshot() {
        return new Snapshot(new LinkedHashMap<>(identityElements));
    }

    public void restore(Snapshot snapshot) {
        identityElements.clear();
        identityElements.putAll(snapshot.identityElements);
    }

    public void clear() {
        identityElements.clear();
        functions.clear();
        dataTypeSorts.clear();
        constructors.clear();
        logger.debug("清空 Z3 声明");
    }

    public Set<String> identityNames() {
        return new LinkedHashSet<>(identityElements.keySet());
    }

    /**
     * 构造子在其数据类型中的位置。
     */
    @Getter
    public static final class ConstructorRef {

        private final String dataType;
        private final int index;
        private final int arity;

        ConstructorRef(String dataType, int index, int arity) {
            this.dataType = dataType;
            this.index = index;
            this.arity = arity;
        }
    }

    /**
     * push 时保存的单位元集合，pop 时恢复。
     */
    public static final class Snapshot {

        private final Map<String, Expr<?>> identityElements;

        Snapshot(Map<String, Expr<?>> identityElements) {
            this.identityElements = identityElements;
        }
    }
}
