package cronmanager.coordinator.service;

import com.cronutils.model.CronType;
import com.cronutils.model.definition.CronDefinition;
import com.cronutils.model.definition.CronDefinitionBuilder;
import com.cronutils.parser.CronParser;

import java.util.Set;

/**
 * Validates expressions against the five-field crontab syntax, so one bad
 * schedule cannot break installation of the whole crontab.
 */
public final class CronExpressions {

    private static final CronParser PARSER;

    static {
        CronDefinition def = CronDefinitionBuilder.instanceDefinitionFor(CronType.UNIX);
        PARSER = new CronParser(def);
    }

    private static final Set<String> MACROS = Set.of(
            "@yearly", "@annually", "@monthly", "@weekly", "@daily", "@midnight", "@hourly");

    private CronExpressions() {
    }

    /**
     * @throws IllegalArgumentException if crontab would reject the expression
     */
    public static void validate(String expression) {
        if (expression == null || expression.isBlank()) {
            throw new IllegalArgumentException("cron expression is empty");
        }
        String trimmed = expression.trim();
        if (trimmed.startsWith("@")) {
            if (!MACROS.contains(trimmed)) {
                throw new IllegalArgumentException("unsupported cron macro '" + trimmed + "'");
            }
            return;
        }
        try {
            PARSER.parse(trimmed).validate();
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("invalid cron expression '" + trimmed + "': " + e.getMessage(), e);
        }
    }
}
