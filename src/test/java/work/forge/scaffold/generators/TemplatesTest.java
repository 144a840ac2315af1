package work.forge.scaffold.generators;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Map;
import org.junit.jupiter.api.Test;

class TemplatesTest {
    @Test
    void fillsPlaceholders() {
        var text = Templates.fill("inline", "name = \"{{project_name}}\" # {{project_name}}", Map.of("project_name", "demo"));
        assertEquals("name = \"demo\" # demo", text);
    }

    @Test
    void leavesJinjaMarkupAlone() {
        var text = Templates.fill("inline", "<p>{{ token }}</p>{{project_name}}", Map.of("project_name", "demo"));
        assertEquals("<p>{{ token }}</p>demo", text);
    }

    @Test
    void valuesAreInsertedLiterally() {
        var text = Templates.fill("inline", "{{command}}", Map.of("command", "echo $HOME \\n"));
        assertEquals("echo $HOME \\n", text);
    }

    @Test
    void unknownPlaceholderFails() {
        var ex = assertThrows(IllegalStateException.class, () -> Templates.fill("inline", "{{missing}}", Map.of()));
        assertTrue(ex.getMessage().contains("missing"));
    }

    @Test
    void missingTemplateFails() {
        assertThrows(IllegalStateException.class, () -> Templates.load("nope/absent.tmpl"));
    }

    @Test
    void loadsBundledTemplates() {
        assertTrue(Templates.load("base/gitignore.tmpl").contains("__pycache__/"));
    }
}
