package org.jsdetect.ensemble;

import org.jsdetect.error.ParseFailureException;
import org.jsdetect.feature.FeatureKind;
import org.jsdetect.feature.FeatureVector;
import org.jsdetect.graph.AnalysisLevel;
import org.jsdetect.select.SelectedFeatures;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

class EnsembleClassifierTests {

	private ExecutorService executor;

	@BeforeEach
	void setup() {
		executor = Executors.newFixedThreadPool(2);
	}

	@AfterEach
	void tearDown() {
		executor.shutdownNow();
	}

	@Test
	void testAllModulesAgree() {
		EnsembleClassifier ensemble = ensemble(
				module("tokens", AnalysisLevel.TOKENS),
				module("ast", AnalysisLevel.AST),
				module("pdg", AnalysisLevel.PDG));

		Map<String, ModelOutput> outputs = ensemble.evaluate(m -> vector("CallExpression", "eval"));
		Assertions.assertEquals(List.of("tokens", "ast", "pdg"), List.copyOf(outputs.keySet()));
		outputs.values().forEach(o -> Assertions.assertEquals(Label.MALICIOUS, o.label()));

		Decision d = ensemble.classify(m -> vector("CallExpression", "eval"));
		Assertions.assertEquals(Decision.decided(Label.MALICIOUS, DecisionTier.UNANIMOUS), d);
	}

	@Test
	void testProjectionMismatchReachesClassifier() {
		EnsembleClassifier ensemble = ensemble(module("ast", AnalysisLevel.AST));
		Decision d = ensemble.classify(m -> vector("Literal"));
		Assertions.assertEquals(Decision.decided(Label.BENIGN, DecisionTier.UNANIMOUS), d);
	}

	@Test
	void testFailedModuleIsUnavailable() {
		EnsembleClassifier ensemble = ensemble(
				module("tokens", AnalysisLevel.TOKENS),
				module("ast", AnalysisLevel.AST),
				module("pdg", AnalysisLevel.PDG));

		Map<String, ModelOutput> outputs = ensemble.evaluate(m -> {
			if (m.level() == AnalysisLevel.PDG) {
				throw new ParseFailureException("broken");
			}
			if (m.level() == AnalysisLevel.TOKENS) {
				return null;
			}
			return vector("eval");
		});
		Assertions.assertEquals(List.of("ast"), List.copyOf(outputs.keySet()));
	}

	@Test
	void testNoModuleAvailableIsDeferred() {
		EnsembleClassifier ensemble = ensemble(module("ast", AnalysisLevel.AST));
		Assertions.assertEquals(Decision.deferred(), ensemble.classify(m -> null));
	}

	@Test
	void testUnexpectedFailurePropagates() {
		EnsembleClassifier ensemble = ensemble(module("ast", AnalysisLevel.AST));
		Assertions.assertThrows(IllegalStateException.class, () -> ensemble.classify(m -> {
			throw new IllegalStateException("model not loaded");
		}));
	}

	private EnsembleClassifier ensemble(DetectionModule... modules) {
		return new EnsembleClassifier(List.of(modules),
				new EnsembleDecider(new EnsembleConfig(0.9, 0.7, null)), executor);
	}

	/**
	 * 含有 eval 就判为恶意
	 */
	private static DetectionModule module(String name, AnalysisLevel level) {
		SelectedFeatures features = new SelectedFeatures(List.of("eval"));
		Classifier classifier = v -> v.mismatch() ? 0.0 : 0.95;
		return new DetectionModule(name, level, FeatureKind.NGRAMS, features, classifier, 0.5);
	}

	private static FeatureVector vector(String... keys) {
		FeatureVector v = new FeatureVector();
		for (String k : keys) {
			v.add(k);
		}
		return v;
	}
}
