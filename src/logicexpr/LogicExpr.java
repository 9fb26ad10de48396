package logicexpr;

import logicexpr.expression.Evaluator;
import logicexpr.expression.Expression;
import logicexpr.expression.Expressions;
import logicexpr.expression.Lexer;
import logicexpr.expression.Optimizer;
import logicexpr.expression.Parser;
import logicexpr.expression.PrettyOptions;
import logicexpr.expression.Token;
import logicexpr.expression.error.ExpressionException;
import logicexpr.expression.error.UnknownVariableException;
import org.json.JSONException;
import org.json.JSONObject;
import org.json.JSONTokener;

import java.io.*;
import java.text.SimpleDateFormat;
import java.util.*;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public class LogicExpr
{
    public static final String VERSION = "1";

    public static File STORAGE_DIR = new File(System.getProperty("user.home", System.getProperty("user.dir", ".")), ".logicexpr");
    public static JSONObject config = new JSONObject();

    public static volatile boolean verbose = false;

    private static final SimpleDateFormat sdfDate = new SimpleDateFormat("dd/MM/yy");
    private static final SimpleDateFormat sdfDateTime = new SimpleDateFormat("dd/MM/yy HH:mm:ss");

    private static final Pattern ASSIGNMENT = Pattern.compile("^([A-Za-z_][A-Za-z0-9_]*)=(.*)$");

    private static PrintStream logStream;
    private static File        logFile;
    private static String      lastLogDate = "";

    private static final PrintStream stdOut = System.out;
    private static final PrintStream stdErr = System.err;

    public static void main(String[] args)
    {
        System.exit(run(args));
    }

    /**
     * Runs the command line and returns its exit code: 0 when every
     * expression evaluated, 1 otherwise.
     */
    public static int run(String[] args)
    {
        int first = 0;
        if (args.length >= 1)
        {
            File storageDir = new File(args[0]);
            if (storageDir.exists() && storageDir.isDirectory())
            {
                STORAGE_DIR = storageDir;
                first = 1;
            }
        }

        reloadConfig();
        if (config.optBoolean("logging", true))
            openLog();

        printOut("[Startup] Starting... (v" + VERSION + ")");

        Map<String, Boolean> env = environment(config);
        List<String> sources = new ArrayList<>();
        for (int i = first; i < args.length; i++)
        {
            Matcher m = ASSIGNMENT.matcher(args[i]);
            if (!m.matches())
                sources.add(args[i]);
            else
            {
                Boolean value = parseBoolean(m.group(2));
                if (value == null)
                    printErr("[Env] Invalid value for " + m.group(1) + ": '" + m.group(2) + "' (use true/false)");
                else
                    env.put(m.group(1), value);
            }
        }

        if (sources.isEmpty())
        {
            printErr("[Main] No expression given");
            printOut("Usage: LogicExpr [storageDir] [NAME=true|false ...] expression...", true);
            closeLog();
            return 1;
        }

        final PrettyOptions options = prettyOptions(config);
        int failures = 0;
        for (String source : sources)
            if (!process(source, env, options))
                failures++;

        printOut("[Main] Processed " + sources.size() + " expression" + (sources.size() == 1 ? "" : "s")
                + ", " + failures + " failed");
        closeLog();

        return failures == 0 ? 0 : 1;
    }

    static boolean process(String source, Map<String, Boolean> env, PrettyOptions options)
    {
        final boolean debug = config.optBoolean("debug", false);

        printOut("[Expr] " + source, true);
        List<Token> tokens = Collections.emptyList();
        try
        {
            tokens = Expressions.tokenize(source);
            if (debug)
                printOut("[Lexer] " + Lexer.debugTokens(tokens));

            Expression expression = new Parser(tokens, source).setDebug(debug).build();
            printOut("[Expr] Printed:   " + Expressions.prettyPrint(expression, options), true);

            if (config.optBoolean("optimize", true))
            {
                Expression optimized = new Optimizer().setDebug(debug).optimize(expression);
                printOut("[Expr] Optimized: " + Expressions.prettyPrint(optimized, options), true);
            }

            boolean result = new Evaluator(env).setDebug(debug).evaluate(expression);
            printOut("[Expr] Result:    " + (result ? Lexer.TRUE_LITERAL : Lexer.FALSE_LITERAL), true);
            return true;
        }
        catch (UnknownVariableException e)
        {
            printErr(Expressions.locate(e, tokens, source).formatError());
            return false;
        }
        catch (ExpressionException e)
        {
            printErr(e.formatError());
            return false;
        }
    }

    //<editor-fold defaultstate="collapsed" desc="Config">
    public static void reloadConfig()
    {
        File configFile = new File(STORAGE_DIR, "config.json");
        if (!configFile.exists())
        {
            config = new JSONObject();
            verbose = false;
            return;
        }

        try (BufferedReader br = new BufferedReader(new FileReader(configFile)))
        {
            config = new JSONObject(new JSONTokener(br));
        }
        catch (IOException | JSONException ex)
        {
            printErr("[Config] Could not load " + configFile + ", using defaults");
            printThrowable(ex, "Config");
            config = new JSONObject();
        }

        verbose = config.optBoolean("verbose", false);
    }

    public static Map<String, Boolean> environment(JSONObject config)
    {
        Map<String, Boolean> env = new LinkedHashMap<>();
        JSONObject envObj = config.optJSONObject("env");
        if (envObj == null)
            return env;

        // JSONObject does not keep key order, sort for stable suggestions
        new TreeSet<>(envObj.keySet()).forEach(name -> {
            Object value = envObj.get(name);
            if (value instanceof Boolean)
                env.put(name, (Boolean) value);
            else
                printErr("[Config] Ignoring non boolean env value " + name + "=" + value);
        });

        return env;
    }

    public static PrettyOptions prettyOptions(JSONObject config)
    {
        PrettyOptions options = PrettyOptions.DEFAULT;
        try
        {
            if (config.has("caseStyle"))
                options = options.withCaseStyle(PrettyOptions.CaseStyle.valueOf(config.getString("caseStyle").toUpperCase(Locale.ROOT)));
            if (config.has("parentheses"))
                options = options.withParentheses(PrettyOptions.Parentheses.valueOf(config.getString("parentheses").toUpperCase(Locale.ROOT)));
            if (config.has("indent"))
                options = options.withIndent(config.getInt("indent"));
        }
        catch (JSONException | IllegalArgumentException ex)
        {
            printErr("[Config] Invalid pretty print option, using " + options + ": " + ex.getMessage());
        }

        return options;
    }

    static Boolean parseBoolean(String value)
    {
        switch (value.trim().toLowerCase(Locale.ROOT))
        {
            case "true":
            case "1":
            case "yes":
            case "on":
                return Boolean.TRUE;
            case "false":
            case "0":
            case "no":
            case "off":
                return Boolean.FALSE;
            default:
                return null;
        }
    }
    //</editor-fold>

    //<editor-fold defaultstate="collapsed" desc="Print methods">
    public static void printThrowable(Throwable t, String name)
    {
        name = name == null ? "" : name;

        StackTraceElement caller = Thread.currentThread().getStackTrace()[2];
        name += (name.isEmpty() ? "" : " ");
        name += caller.getFileName() != null && caller.getLineNumber() >= 0 ?
                "(" + caller.getFileName() + ":" + caller.getLineNumber() + ")" :
                (caller.getFileName() != null ?  "("+caller.getFileName()+")" : "(Unknown Source)");

        printErr("[" + name + "] " + t.toString());

        for (StackTraceElement element : t.getStackTrace())
            printErr("[" + name + "] -> " + element.toString());

        Throwable cause = t.getCause();
        if (cause != null && cause != t)
        {
            printErr("[" + name + "] Caused by " + cause);
            for (StackTraceElement element : cause.getStackTrace())
                printErr("[" + name + "] -> " + element.toString());
        }
    }

    public static void printOut(String message)
    {
        printOut(message, verbose);
    }

    public static void printOut(String message, boolean forceStdout)
    {
        if (message != null && !message.isEmpty())
            for (String msgPart : message.split("\n"))
                print("[" + timestamp() + "] " + msgPart, false, forceStdout);
    }

    public static void printErr(String message)
    {
        if (message != null && !message.isEmpty())
            for (String msgPart : message.split("\n"))
                print("[" + timestamp() + "] !!!> " + msgPart + " <!!!", true, true);
    }

    private static synchronized String timestamp()
    {
        return sdfDateTime.format(new Date());
    }

    private static synchronized void print(String message, boolean toErr, boolean forceStdout)
    {
        if (toErr)
            stdErr.println(message);
        else if (forceStdout)
            stdOut.println(message);

        filePrint(message);
    }

    private static synchronized void openLog()
    {
        lastLogDate = sdfDate.format(new Date());
        logFile = new File(STORAGE_DIR, "Logs" + File.separator + "LogicExpr" + File.separator + lastLogDate.replace("/", "-") + ".log");
        logFile.getParentFile().mkdirs();

        try
        {
            logStream = new PrintStream(new FileOutputStream(logFile, true), true);
        }
        catch (FileNotFoundException e)
        {
            logStream = null;
            printErr("[Logging] Could not create log file " + logFile);
        }
    }

    private static synchronized void closeLog()
    {
        if (logStream != null)
            logStream.close();
        logStream = null;
    }

    private static synchronized void filePrint(String message)
    {
        if (logStream == null)
            return;

        if (!lastLogDate.equals(sdfDate.format(new Date())))
        {
            logStream.close();
            openLog();
            if (logStream == null)
                return;
        }

        logStream.println(message);
    }
    //</editor-fold>
}
