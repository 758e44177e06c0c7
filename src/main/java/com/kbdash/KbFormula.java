package com.kbdash;

import com.kbdash.formula.FormulaCompiler;
import com.kbdash.formula.FormulaSyntaxException;
import com.kbdash.formula.ParseOutcome;
import com.kbdash.json.JsonNode;
import com.kbdash.json.JsonReader;
import com.kbdash.output.OutcomeReport;
import com.kbdash.output.OutputFormatter;
import org.eclipse.collections.api.map.primitive.IntObjectMap;
import org.eclipse.collections.impl.factory.primitive.IntObjectMaps;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.PrintWriter;
import java.util.concurrent.Callable;

@Command(name = "kbformula", mixinStandardHelpOptions = true, version = "1.0",
         description = "Parse a Kibana Lens formula and print its tinymath AST")
public class KbFormula implements Callable<Integer> {
    private static final Logger logger = LoggerFactory.getLogger(KbFormula.class);

    @Spec
    private CommandSpec spec;

    @Parameters(index = "0", description = "The formula, e.g. \"count(kql='status:error') / count()\"")
    private String formula;

    @Option(names = {"-c", "--compact-output"}, description = "Compact output without whitespace")
    private boolean compactOutput = false;

    @Option(names = {"-S", "--sort-keys"}, description = "Sort object keys in output")
    private boolean sortKeys = false;

    @Option(names = {"-r", "--refs"}, description = "Print the extracted aggregation and pipeline references instead of the AST")
    private boolean printRefs = false;

    @Option(names = "--ids", paramLabel = "JSON",
            description = "Column identifiers by aggregation index, e.g. '{\"0\":\"col-a\"}'")
    private String aggregationIds;

    @Option(names = "--pipeline-ids", paramLabel = "JSON",
            description = "Column identifiers by pipeline operation index")
    private String pipelineIds;

    public static void main(String[] args) {
        int exitCode = new CommandLine(new KbFormula()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() throws Exception {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();
        try {
            ParseOutcome outcome = FormulaCompiler.shared().parse(formula);
            OutputFormatter formatter = new OutputFormatter(!compactOutput, sortKeys);

            if (printRefs) {
                out.println(formatter.format(OutcomeReport.toJson(outcome)));
                return 0;
            }

            JsonReader reader = new JsonReader();
            JsonNode ast = FormulaCompiler.shared().substitute(
                    outcome, readIds(reader, aggregationIds), readIds(reader, pipelineIds));
            out.println(formatter.format(ast));
            return 0;
        } catch (FormulaSyntaxException e) {
            logger.warn("Rejected formula '{}' at position {}: {}", e.formula(), e.position(), e.reason());
            err.println("Error: " + e.getMessage());
            return 1;
        } catch (Exception e) {
            err.println("Error: " + e.getMessage());
            return 1;
        }
    }

    private static IntObjectMap<String> readIds(JsonReader reader, String json) throws IOException {
        if (json == null || json.isBlank()) {
            return IntObjectMaps.immutable.empty();
        }
        return reader.readIdentifierMap(json);
    }
}
