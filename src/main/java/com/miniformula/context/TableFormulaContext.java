package com.miniformula.context;

import com.miniformula.CommonConstant;
import com.miniformula.compiler.ContextFunction;
import com.miniformula.error.FormulaException;
import com.miniformula.error.FormulaReferenceException;
import com.miniformula.error.Messages;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * TableFormulaContext - 表格上下文
 *
 * 在 {@link MapFormulaContext} 的基础上增加:
 * - 行(case)数据: 每行是属性名到值的映射, 求值上下文指定当前行
 * - 聚合函数: 跨所有行求值, 如 mean(x)
 *
 * 聚合函数的编译:
 * <pre>
 * mean(x) + x
 *   → runtime.add(context.evaluateAggregate(0,evalContext),context.evaluateVariable("x",evalContext))
 * </pre>
 * 每个不同的聚合调用(函数名加参数片段)在聚合登记表中占一项, 下标一经分配不再变化,
 * 同一上下文上的多个公式可以各自缓存编译结果。相同的聚合调用共用一项。
 * 参数片段单独编译成可调用对象存在登记项中。
 * 运行时 evaluateAggregate 对每一行求一次参数, 再交给聚合函数归约。
 *
 * 缓存:
 * - 聚合结果与当前行无关, 按依赖变量在求值上下文中的绑定值缓存
 * - 编译时记录每个聚合依赖的变量名(来自compileVariable的外层聚合下标)
 * - 行数据或上下文变量变化时只清掉依赖它的聚合结果
 * - 函数或聚合函数注册变化时清掉所有聚合结果
 *
 * 直接求值和后缀求值拿不到参数的编译结果, 调用聚合函数会报错。
 */
public class TableFormulaContext extends MapFormulaContext {

    private static final Logger logger = LoggerFactory.getLogger(TableFormulaContext.class);

    /** 行数据 */
    private final List<Map<String, Object>> cases = new ArrayList<>();

    /** 聚合函数 */
    private final Map<String, AggregateFunction> aggregates = new HashMap<>();

    /** 聚合登记表, 下标即生成脚本中的聚合下标 */
    private final List<AggregateSlot> aggregateSlots = new ArrayList<>();

    /** 聚合调用的脚本片段 → 登记表下标 */
    private final Map<String, Integer> aggregateIndexByCall = new HashMap<>();

    /** 本次编译中的聚合调用, 键是编译期下标 */
    private final Map<Integer, AggregateSlot> compilingSlots = new HashMap<>();

    // ==================== 行数据 ====================

    /**
     * 追加一行
     *
     * 新出现的属性名是命名空间变化, 行数变化使所有聚合结果失效。
     *
     * @param values 属性值
     * @return 新行的下标
     */
    public int addCase(Map<String, ?> values) {
        Set<String> known = getAttributeNames();
        cases.add(new LinkedHashMap<>(values));
        clearAggregateResults();
        for (String attribute : values.keySet()) {
            if (!known.contains(attribute)) {
                fireNamespaceChanged(attribute);
            }
        }
        for (String attribute : values.keySet()) {
            fireDependentChanged(attribute);
        }
        return cases.size() - 1;
    }

    /**
     * 修改某一行的属性值
     *
     * @param caseIndex 行下标
     * @param attribute 属性名
     * @param value 新值
     */
    public void setCaseValue(int caseIndex, String attribute, Object value) {
        Map<String, Object> row = cases.get(caseIndex);
        boolean newAttribute = !getAttributeNames().contains(attribute);
        row.put(attribute, value);
        invalidateDependents(attribute);
        if (newAttribute) {
            fireNamespaceChanged(attribute);
        }
        fireDependentChanged(attribute);
    }

    public int getCaseCount() {
        return cases.size();
    }

    public Map<String, Object> getCase(int caseIndex) {
        return Collections.unmodifiableMap(cases.get(caseIndex));
    }

    /**
     * 所有行中出现过的属性名
     */
    public Set<String> getAttributeNames() {
        Set<String> names = new HashSet<>();
        for (Map<String, Object> row : cases) {
            names.addAll(row.keySet());
        }
        return names;
    }

    // ==================== 聚合函数 ====================

    /**
     * 注册聚合函数
     */
    public void registerAggregate(String name, AggregateFunction function) {
        aggregates.put(name, function);
        clearAggregateResults();
        fireNamespaceChanged(name);
    }

    @Override
    public boolean isAggregate(String name) {
        return aggregates.containsKey(name);
    }

    /**
     * 聚合登记表的项数
     */
    public int getAggregateSlotCount() {
        return aggregateSlots.size();
    }

    /**
     * 某个聚合下标依赖的属性名
     */
    public Set<String> getAggregateDependencies(int index) {
        return Collections.unmodifiableSet(slot(index).dependencies);
    }

    @Override
    protected void variableChanged(String name) {
        invalidateDependents(name);
    }

    @Override
    protected void functionChanged(String name) {
        clearAggregateResults();
    }

    private void invalidateDependents(String name) {
        for (AggregateSlot slot : aggregateSlots) {
            if (slot.dependencies.contains(name)) {
                slot.invalidate();
            }
        }
    }

    private void clearAggregateResults() {
        for (AggregateSlot slot : aggregateSlots) {
            slot.invalidate();
        }
    }

    // ==================== 编译 ====================

    @Override
    public void willCompile() {
        super.willCompile();
        compilingSlots.clear();
    }

    @Override
    public void completeCompile() {
        super.completeCompile();
        compilingSlots.clear();
    }

    @Override
    protected void aggregateRegistered(String name, int index) {
        compilingSlots.put(index, new AggregateSlot(name));
    }

    @Override
    public String compileVariable(String name, Set<Integer> aggregateIndices) {
        for (Integer index : aggregateIndices) {
            compilingSlot(index).dependencies.add(name);
        }
        return super.compileVariable(name, aggregateIndices);
    }

    @Override
    public String compileFunction(String name, List<String> arguments, Set<Integer> aggregateIndices) {
        if (!isAggregate(name) || aggregateIndices.isEmpty()) {
            return super.compileFunction(name, arguments, aggregateIndices);
        }

        // 最内层的聚合下标就是本函数自己
        int compileIndex = -1;
        for (Integer i : aggregateIndices) {
            compileIndex = i;
        }
        String call = name + "(" + String.join(",", arguments) + ")";
        Integer index = aggregateIndexByCall.get(call);
        if (index == null) {
            AggregateSlot slot = compilingSlot(compileIndex);
            for (String argument : arguments) {
                slot.arguments.add(createContextFunction(argument));
            }
            index = aggregateSlots.size();
            aggregateSlots.add(slot);
            aggregateIndexByCall.put(call, index);
        }
        return CommonConstant.CONTEXT_RECEIVER + ".evaluateAggregate(" + index + ","
                + CommonConstant.EVAL_CONTEXT_REFERENCE + ")";
    }

    private AggregateSlot compilingSlot(int compileIndex) {
        AggregateSlot slot = compilingSlots.get(compileIndex);
        if (slot == null) {
            throw new FormulaException(Messages.get("formula.aggregate.invalidIndex", compileIndex));
        }
        return slot;
    }

    // ==================== 求值 ====================

    @Override
    public Object evaluateVariable(String name, EvalContext evalContext) {
        EvalContext ec = EvalContext.orEmpty(evalContext);
        if (!ec.has(name) && ec.hasCase() && ec.getCaseIndex() < cases.size()) {
            Map<String, Object> row = cases.get(ec.getCaseIndex());
            if (row.containsKey(name)) {
                return row.get(name);
            }
        }
        return super.evaluateVariable(name, ec);
    }

    @Override
    public Object evaluateFunction(String name, List<Object> arguments) {
        if (isAggregate(name)) {
            throw new FormulaException(Messages.get("formula.aggregate.directEvaluation", name));
        }
        return super.evaluateFunction(name, arguments);
    }

    @Override
    public Object evaluateAggregate(int index, EvalContext evalContext) {
        AggregateSlot slot = slot(index);
        EvalContext ec = EvalContext.orEmpty(evalContext);
        Map<String, Object> bindings = boundDependencies(slot, ec);
        if (slot.evaluated && slot.bindings.equals(bindings)) {
            return slot.result;
        }

        logger.debug("计算聚合函数: {}[{}], 行数: {}, 绑定: {}", slot.name, index, cases.size(), bindings);
        AggregateFunction function = aggregates.get(slot.name);
        if (function == null) {
            throw new FormulaReferenceException(slot.name, FormulaReferenceException.Kind.FUNCTION);
        }
        List<List<Object>> argumentsPerCase = new ArrayList<>(cases.size());
        for (int i = 0; i < cases.size(); i++) {
            EvalContext caseContext = ec.withCaseIndex(i);
            List<Object> values = new ArrayList<>(slot.arguments.size());
            for (ContextFunction argument : slot.arguments) {
                values.add(argument.apply(this, caseContext));
            }
            argumentsPerCase.add(values);
        }

        slot.result = function.aggregate(argumentsPerCase);
        slot.bindings = bindings;
        slot.evaluated = true;
        return slot.result;
    }

    /**
     * 求值上下文中绑定了的依赖变量, 它们会覆盖行数据和上下文变量
     */
    private static Map<String, Object> boundDependencies(AggregateSlot slot, EvalContext ec) {
        Map<String, Object> bindings = new HashMap<>();
        for (String name : slot.dependencies) {
            if (ec.has(name)) {
                bindings.put(name, ec.get(name));
            }
        }
        return bindings;
    }

    private AggregateSlot slot(int index) {
        if (index < 0 || index >= aggregateSlots.size()) {
            throw new FormulaException(Messages.get("formula.aggregate.invalidIndex", index));
        }
        return aggregateSlots.get(index);
    }

    /**
     * 聚合登记表中的一项
     */
    private static final class AggregateSlot {
        final String name;
        final List<ContextFunction> arguments = new ArrayList<>();
        final Set<String> dependencies = new HashSet<>();
        boolean evaluated;
        Object result;
        /** 计算result时依赖变量的绑定值 */
        Map<String, Object> bindings = Collections.emptyMap();

        AggregateSlot(String name) {
            this.name = name;
        }

        void invalidate() {
            evaluated = false;
            result = null;
            bindings = Collections.emptyMap();
        }

        @Override
        public String toString() {
            return name + dependencies;
        }
    }
}
