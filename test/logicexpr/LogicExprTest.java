package logicexpr;

import logicexpr.expression.PrettyOptions;
import org.json.JSONObject;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class LogicExprTest
{
    @TempDir
    Path storage;

    private void writeConfig(String json) throws IOException
    {
        Files.write(storage.resolve("config.json"), json.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    void testEvaluatesExpressions() throws IOException
    {
        writeConfig("{\"logging\": false}");

        assertEquals(0, LogicExpr.run(new String[] {storage.toString(), "A=true", "B=off", "A AND NOT B", "A OR B"}));
    }

    @Test
    void testFailuresGiveExitCodeOne() throws IOException
    {
        writeConfig("{\"logging\": false}");

        assertEquals(1, LogicExpr.run(new String[] {storage.toString(), "A AND"}));
        assertEquals(1, LogicExpr.run(new String[] {storage.toString(), "UNKNOWN AND FALSE"}));
        assertEquals(1, LogicExpr.run(new String[] {storage.toString(), "TRUE", "A ! B"}));
        assertEquals(1, LogicExpr.run(new String[] {storage.toString()}));
    }

    @Test
    void testEnvironmentFromConfig() throws IOException
    {
        writeConfig("{\"logging\": false, \"debug\": true, \"env\": {\"Flag\": true, \"Other\": false}}");

        assertEquals(0, LogicExpr.run(new String[] {storage.toString(), "Flag AND NOT Other"}));
        assertEquals(0, LogicExpr.run(new String[] {storage.toString(), "Flag=false", "NOT Flag"}));
    }

    @Test
    void testEnvironmentSkipsNonBooleans()
    {
        JSONObject config = new JSONObject("{\"env\": {\"b\": false, \"a\": true, \"n\": 1, \"s\": \"true\"}}");
        Map<String, Boolean> env = LogicExpr.environment(config);

        assertEquals(2, env.size());
        assertEquals(Boolean.TRUE, env.get("a"));
        assertEquals(Boolean.FALSE, env.get("b"));
        assertEquals("a", env.keySet().iterator().next());
        assertTrue(LogicExpr.environment(new JSONObject()).isEmpty());
    }

    @Test
    void testPrettyOptionsFromConfig()
    {
        JSONObject config = new JSONObject("{\"caseStyle\": \"mixed\", \"parentheses\": \"always\", \"indent\": 2}");

        assertEquals(new PrettyOptions(PrettyOptions.CaseStyle.MIXED, PrettyOptions.Parentheses.ALWAYS, 2),
                LogicExpr.prettyOptions(config));
        assertEquals(PrettyOptions.DEFAULT, LogicExpr.prettyOptions(new JSONObject()));
        assertEquals(PrettyOptions.DEFAULT, LogicExpr.prettyOptions(new JSONObject("{\"caseStyle\": \"shouty\"}")));
    }

    @Test
    void testMalformedConfigFallsBackToDefaults() throws IOException
    {
        writeConfig("{ not json");

        LogicExpr.STORAGE_DIR = storage.toFile();
        LogicExpr.reloadConfig();

        assertEquals(0, LogicExpr.config.length());
        assertFalse(LogicExpr.verbose);
    }

    @Test
    void testWritesLogFile() throws IOException
    {
        writeConfig("{\"logging\": true}");

        assertEquals(0, LogicExpr.run(new String[] {storage.toString(), "TRUE OR FALSE"}));

        File logDir = storage.resolve("Logs").resolve("LogicExpr").toFile();
        File[] logs = logDir.listFiles();
        assertNotNull(logs);
        assertEquals(1, logs.length);

        List<String> lines = Files.readAllLines(logs[0].toPath(), StandardCharsets.UTF_8);
        assertTrue(lines.stream().anyMatch(l -> l.contains("[Expr] Result:    TRUE")), lines::toString);
    }

    @Test
    void testParseBoolean()
    {
        assertEquals(Boolean.TRUE, LogicExpr.parseBoolean("Yes"));
        assertEquals(Boolean.FALSE, LogicExpr.parseBoolean(" 0 "));
        assertNull(LogicExpr.parseBoolean("maybe"));
    }
}
