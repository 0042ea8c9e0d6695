package com.multigallery.core.renderer;

import com.multigallery.core.ast.Condition;
import com.multigallery.core.ast.ConditionOperator;
import com.multigallery.core.ast.ConditionParameter;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link ConditionEvaluator}.
 */
class ConditionEvaluatorTest {

    private final ConditionEvaluator evaluator = new ConditionEvaluator();

    private final RenderContext furaffinity =
        new RenderContext("furaffinity", Set.of("nsfw", "preview"), Map.of());

    @Test
    void evaluate_siteEquals_comparesTargetSite() {
        assertThat(evaluator.evaluate(site(ConditionOperator.EQ, "furaffinity"), furaffinity)).isTrue();
        assertThat(evaluator.evaluate(site(ConditionOperator.EQ, "weasyl"), furaffinity)).isFalse();
    }

    @Test
    void evaluate_siteNotEquals_negates() {
        assertThat(evaluator.evaluate(site(ConditionOperator.NOT_EQ, "furaffinity"), furaffinity)).isFalse();
        assertThat(evaluator.evaluate(site(ConditionOperator.NOT_EQ, "weasyl"), furaffinity)).isTrue();
    }

    @Test
    void evaluate_siteIn_checksMembership() {
        Condition condition = new Condition(ConditionParameter.SITE, ConditionOperator.IN,
            Set.of("aryion", "furaffinity"));

        assertThat(evaluator.evaluate(condition, furaffinity)).isTrue();
        assertThat(evaluator.evaluate(condition, RenderContext.forSite("weasyl"))).isFalse();
    }

    @Test
    void evaluate_define_checksDefinedFlags() {
        assertThat(evaluator.evaluate(define(ConditionOperator.EQ, "nsfw"), furaffinity)).isTrue();
        assertThat(evaluator.evaluate(define(ConditionOperator.EQ, "sfw"), furaffinity)).isFalse();
        assertThat(evaluator.evaluate(define(ConditionOperator.NOT_EQ, "sfw"), furaffinity)).isTrue();
    }

    @Test
    void evaluate_defineIn_isTrueWhenAnyFlagIsDefined() {
        Condition condition = new Condition(ConditionParameter.DEFINE, ConditionOperator.IN,
            Set.of("teaser", "preview"));

        assertThat(evaluator.evaluate(condition, furaffinity)).isTrue();
        assertThat(evaluator.evaluate(condition, RenderContext.forSite("furaffinity"))).isFalse();
    }

    @Test
    void evaluate_defineDoesNotResolveSiteAliases() {
        RenderContext context = new RenderContext("furaffinity", Set.of("fa"), Map.of());

        assertThat(evaluator.evaluate(define(ConditionOperator.EQ, "furaffinity"), context)).isFalse();
    }

    private static Condition site(ConditionOperator operator, String operand) {
        return Condition.of(ConditionParameter.SITE, operator, operand);
    }

    private static Condition define(ConditionOperator operator, String operand) {
        return Condition.of(ConditionParameter.DEFINE, operator, operand);
    }
}
