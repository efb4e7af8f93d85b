package com.sfuplan.prereq.validation;

import com.sfuplan.prereq.domain.PrerequisiteNode;
import com.sfuplan.prereq.domain.PrerequisiteNode.And;
import com.sfuplan.prereq.domain.PrerequisiteNode.Course;
import com.sfuplan.prereq.domain.PrerequisiteNode.Or;
import com.sfuplan.prereq.domain.PrerequisiteNode.Unknown;
import com.sfuplan.prereq.validation.ValidationModels.EvaluationResult;
import org.springframework.stereotype.Component;

import java.util.LinkedHashSet;
import java.util.Set;

@Component
public class PrerequisiteEvaluator {

    public EvaluationResult evaluate(PrerequisiteNode tree, Set<String> completed) {
        if (tree == null) return EvaluationResult.passed();
        Set<String> missing = new LinkedHashSet<>();
        boolean satisfied = evaluate(tree, completed == null ? Set.of() : completed, missing);
        return satisfied ? EvaluationResult.passed() : new EvaluationResult(false, missing.stream().toList());
    }

    private boolean evaluate(PrerequisiteNode node, Set<String> completed, Set<String> missing) {
        if (node instanceof Course c) {
            if (completed.contains(c.course())) return true;
            missing.add(c.course());
            return false;
        }
        if (node instanceof And group) {
            boolean all = true;
            for (PrerequisiteNode child : group.children()) {
                all &= evaluate(child, completed, missing);
            }
            return all;
        }
        if (node instanceof Or group) {
            Set<String> options = new LinkedHashSet<>();
            for (PrerequisiteNode child : group.children()) {
                Set<String> childMissing = new LinkedHashSet<>();
                if (evaluate(child, completed, childMissing)) return true;
                options.addAll(childMissing);
            }
            missing.addAll(options);
            return false;
        }
        if (node instanceof Unknown) return true;
        throw new IllegalStateException("Unhandled prerequisite node " + node.getClass().getSimpleName());
    }
}
