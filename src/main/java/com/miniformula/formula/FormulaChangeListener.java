package com.miniformula.formula;

/**
 * 公式变化监听器
 */
@FunctionalInterface
public interface FormulaChangeListener {

    void formulaChanged(FormulaChangeEvent event);
}
