package org.jsdetect;

import org.jsdetect.export.FeatureJson;
import org.jsdetect.graph.AnalysisLevel;
import org.jsdetect.pipeline.AnalysisConfig;
import org.jsdetect.pipeline.CorpusEntry;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

class MainTests {

	@TempDir
	Path tempDir;

	@Test
	void testCorporaAndSelection() throws Exception {
		Path benign = Files.createDirectories(tempDir.resolve("benign"));
		Path malicious = Files.createDirectories(tempDir.resolve("malicious"));
		Files.copy(Js.fixture("scenario_a.json"), benign.resolve("scenario_a.json"));
		Files.copy(Js.fixture("scenario_b.json"), benign.resolve("scenario_b.json"));
		Files.copy(Js.fixture("loop_eval.json"), malicious.resolve("loop_eval.json"));
		Files.copy(Js.fixture("malformed.json"), malicious.resolve("malformed.json"));

		AnalysisConfig config = new AnalysisConfig();
		config.minDocumentFrequency = 0;
		config.corpora = List.of(
				new CorpusEntry(benign.toString(), "benign"),
				new CorpusEntry(malicious.toString(), "malicious"));
		config.validation = config.corpora;
		Path out = tempDir.resolve("out");
		config.outputDir = out.toString();
		Path configFile = tempDir.resolve("config.json");
		Files.writeString(configFile, config.toJson(), StandardCharsets.UTF_8);

		Main.main(new String[]{configFile.toString()});

		Assertions.assertTrue(Files.exists(out.resolve("features/scenario_a.pdg_ngrams.json")));
		Assertions.assertTrue(Files.exists(out.resolve("graphs/loop_eval.pdg.json")));
		// 读取失败的文件不产生输出
		Assertions.assertFalse(Files.exists(out.resolve("features/malformed.pdg_ngrams.json")));
		Assertions.assertNotNull(FeatureJson.readSelected(out.resolve("selected_pdg_ngrams.json")));
	}

	@Test
	void testWritesDotNextToGraphJson() throws Exception {
		Path benign = Files.createDirectories(tempDir.resolve("benign"));
		Files.copy(Js.fixture("scenario_a.json"), benign.resolve("scenario_a.json"));

		AnalysisConfig config = new AnalysisConfig();
		config.level = AnalysisLevel.CFG;
		config.writeDot = true;
		config.corpora = List.of(new CorpusEntry(benign.toString(), "benign"));
		Path out = tempDir.resolve("out");
		config.outputDir = out.toString();
		Path configFile = tempDir.resolve("config.json");
		Files.writeString(configFile, config.toJson(), StandardCharsets.UTF_8);

		Main.main(new String[]{configFile.toString()});

		Assertions.assertTrue(Files.exists(out.resolve("graphs/scenario_a.cfg.json")));
		String dot = Files.readString(out.resolve("graphs/scenario_a.cfg.dot"), StandardCharsets.UTF_8);
		Assertions.assertTrue(dot.startsWith("digraph \"scenario_a.json\" {"));
		Assertions.assertTrue(dot.contains(" -> "));
	}

	@Test
	void testNoDotByDefault() throws Exception {
		Path benign = Files.createDirectories(tempDir.resolve("benign"));
		Files.copy(Js.fixture("scenario_a.json"), benign.resolve("scenario_a.json"));

		AnalysisConfig config = new AnalysisConfig();
		config.corpora = List.of(new CorpusEntry(benign.toString(), "benign"));
		Path out = tempDir.resolve("out");
		config.outputDir = out.toString();
		Path configFile = tempDir.resolve("config.json");
		Files.writeString(configFile, config.toJson(), StandardCharsets.UTF_8);

		Main.main(new String[]{configFile.toString()});

		Assertions.assertTrue(Files.exists(out.resolve("graphs/scenario_a.pdg.json")));
		Assertions.assertFalse(Files.exists(out.resolve("graphs/scenario_a.pdg.dot")));
	}
}
