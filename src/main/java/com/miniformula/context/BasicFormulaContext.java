package com.miniformula.context;

import com.miniformula.error.FormulaReferenceException;

import java.util.List;

/**
 * BasicFormulaContext - 默认上下文
 *
 * 没有任何变量和函数, 只能读取求值上下文中的绑定值。
 * 公式没有设置上下文时自动创建这个。
 */
public class BasicFormulaContext extends AbstractFormulaContext {

    @Override
    public Object evaluateVariable(String name, EvalContext evalContext) {
        EvalContext ec = EvalContext.orEmpty(evalContext);
        if (ec.has(name)) {
            return ec.get(name);
        }
        throw new FormulaReferenceException(name, FormulaReferenceException.Kind.VARIABLE);
    }

    @Override
    public Object evaluateFunction(String name, List<Object> arguments) {
        throw new FormulaReferenceException(name, FormulaReferenceException.Kind.FUNCTION);
    }

    @Override
    public boolean isAggregate(String name) {
        return false;
    }
}
