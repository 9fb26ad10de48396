package logicexpr.expression;

import logicexpr.expression.error.FormatException;
import org.json.JSONException;
import org.json.JSONObject;

/**
 * Converts trees to and from their record form, a JSON object with a
 * {@code type} discriminator:
 * <pre>
 * {"type":"Var","name":"A"}
 * {"type":"BoolLit","value":true}
 * {"type":"Not","operand":{...}}
 * {"type":"BinOp","op":"AND","left":{...},"right":{...}}
 * </pre>
 */
public class Records implements ExpressionVisitor<JSONObject>
{
    public static final String TYPE = "type";
    public static final String NAME = "name";
    public static final String VALUE = "value";
    public static final String OPERAND = "operand";
    public static final String OP = "op";
    public static final String LEFT = "left";
    public static final String RIGHT = "right";

    private static final Records WRITER = new Records();

    private Records() {}

    public static JSONObject toRecord(Expression expression)
    {
        return expression.accept(WRITER);
    }

    public static Expression fromRecord(String json)
    {
        if (json == null)
            throw new FormatException("Missing record", "$");

        JSONObject record;
        try
        {
            record = new JSONObject(json);
        }
        catch (JSONException e)
        {
            throw new FormatException("Malformed record JSON: " + e.getMessage(), "$", e);
        }

        return fromRecord(record);
    }

    public static Expression fromRecord(JSONObject record)
    {
        return read(record, "$");
    }

    @Override
    public JSONObject visitVar(Var var)
    {
        JSONObject record = new JSONObject();
        record.put(TYPE, "Var");
        record.put(NAME, var.getName());
        return record;
    }

    @Override
    public JSONObject visitBoolLit(BoolLit literal)
    {
        JSONObject record = new JSONObject();
        record.put(TYPE, "BoolLit");
        record.put(VALUE, literal.getValue());
        return record;
    }

    @Override
    public JSONObject visitNot(Not not)
    {
        JSONObject record = new JSONObject();
        record.put(TYPE, "Not");
        record.put(OPERAND, not.getOperand().accept(this));
        return record;
    }

    @Override
    public JSONObject visitBinOp(BinOp binOp)
    {
        JSONObject record = new JSONObject();
        record.put(TYPE, "BinOp");
        record.put(OP, binOp.getOp().name());
        record.put(LEFT, binOp.getLeft().accept(this));
        record.put(RIGHT, binOp.getRight().accept(this));
        return record;
    }

    private static Expression read(JSONObject record, String path)
    {
        if (record == null)
            throw new FormatException("Missing record", path);

        String type = field(record, TYPE, String.class, path);
        switch (type)
        {
            case "Var":
            {
                String name = field(record, NAME, String.class, path);
                if (!Lexer.isIdentifier(name))
                    throw new FormatException("Invalid variable name '" + name + "'", path);
                return new Var(name);
            }

            case "BoolLit":
                return BoolLit.of(field(record, VALUE, Boolean.class, path));

            case "Not":
                return new Not(read(field(record, OPERAND, JSONObject.class, path), path + "." + OPERAND));

            case "BinOp":
            {
                String op = field(record, OP, String.class, path);
                Operator operator;
                try
                {
                    operator = Operator.valueOf(op);
                }
                catch (IllegalArgumentException e)
                {
                    throw new FormatException("Unknown operator '" + op + "'", path, e);
                }

                return new BinOp(operator,
                        read(field(record, LEFT, JSONObject.class, path), path + "." + LEFT),
                        read(field(record, RIGHT, JSONObject.class, path), path + "." + RIGHT));
            }

            default:
                throw new FormatException("Unknown node type '" + type + "'", path);
        }
    }

    private static <T> T field(JSONObject record, String key, Class<T> type, String path)
    {
        if (!record.has(key) || record.isNull(key))
            throw new FormatException("Missing field '" + key + "'", path);

        Object value = record.get(key);
        if (!type.isInstance(value))
            throw new FormatException("Field '" + key + "' should be " + type.getSimpleName()
                    + " but was " + value.getClass().getSimpleName(), path);

        return type.cast(value);
    }
}
