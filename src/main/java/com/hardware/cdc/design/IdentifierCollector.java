package com.hardware.cdc.design;

import java.util.Set;
import java.util.TreeSet;

import com.hardware.cdc.ast.IdentifierNode;
import com.hardware.cdc.ast.IndexNode;
import com.hardware.cdc.ast.SyntaxNode;
import com.hardware.cdc.ast.SyntaxTreeScanner;

/**
 * Collects the signal names an expression reads. A constant bit select is
 * reported as {@code name[index]}, any other select as the plain name.
 */
public class IdentifierCollector extends SyntaxTreeScanner<Set<String>> {

    private final ConstantEvaluator evaluator;

    public IdentifierCollector(ConstantEvaluator evaluator) {
        this.evaluator = evaluator;
    }

    public Set<String> collect(SyntaxNode expression) {
        Set<String> names = new TreeSet<>();
        scan(expression, names);
        return names;
    }

    @Override
    public void visit(IdentifierNode identifier, Set<String> names) {
        names.add(identifier.getName());
    }

    @Override
    public void visit(IndexNode index, Set<String> names) {
        if (index.getTarget() instanceof IdentifierNode target) {
            evaluator.evaluate(index.getIndex()).ifPresentOrElse(
                    bit -> names.add(target.getName() + "[" + bit + "]"),
                    () -> names.add(target.getName()));
        } else {
            scan(index.getTarget(), names);
        }
        scan(index.getIndex(), names);
    }
}
