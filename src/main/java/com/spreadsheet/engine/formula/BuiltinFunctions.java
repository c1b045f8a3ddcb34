package com.spreadsheet.engine.formula;

import com.spreadsheet.engine.models.CellValue;
import com.spreadsheet.engine.models.ErrorKind;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;

import static com.spreadsheet.engine.formula.FunctionRegistry.VARIADIC;

/**
 * The built-in function library: aggregates, logic, math and text.
 * <p>
 * Aggregates skip Empty cells and ignore text and booleans found inside
 * ranges; values passed directly as arguments are coerced, and a
 * non-numeric one is a #VALUE! error.
 */
public final class BuiltinFunctions {

    private BuiltinFunctions() {
    }

    public static void register(FunctionRegistry registry) {
        // Aggregates
        registry.registerAggregate("SUM", 1, VARIADIC, args -> {
            double sum = 0;
            for (double n : numbers("SUM", args)) {
                sum += n;
            }
            return EvaluationResult.number(sum);
        });
        registry.registerAggregate("AVERAGE", 1, VARIADIC, args -> {
            List<Double> numbers = numbers("AVERAGE", args);
            if (numbers.isEmpty()) {
                return EvaluationResult.error(ErrorKind.DIV_ZERO, "AVERAGE of no numbers");
            }
            double sum = 0;
            for (double n : numbers) {
                sum += n;
            }
            return EvaluationResult.number(sum / numbers.size());
        });
        registry.registerAggregate("COUNT", 1, VARIADIC, args -> {
            int count = 0;
            for (FunctionArgument arg : args) {
                for (CellValue value : arg.getValues()) {
                    if (arg.isRange() ? value instanceof CellValue.NumberValue
                            : !value.isEmpty() && ValueCoercion.toNumber(value) != null) {
                        count++;
                    }
                }
            }
            return EvaluationResult.number(count);
        });
        registry.registerAggregate("COUNTA", 1, VARIADIC, args -> {
            int count = 0;
            for (FunctionArgument arg : args) {
                for (CellValue value : arg.getValues()) {
                    if (!value.isEmpty()) {
                        count++;
                    }
                }
            }
            return EvaluationResult.number(count);
        });
        registry.registerAggregate("MIN", 1, VARIADIC, args -> {
            List<Double> numbers = numbers("MIN", args);
            return EvaluationResult.number(numbers.isEmpty() ? 0 : numbers.stream().mapToDouble(Double::doubleValue).min().getAsDouble());
        });
        registry.registerAggregate("MAX", 1, VARIADIC, args -> {
            List<Double> numbers = numbers("MAX", args);
            return EvaluationResult.number(numbers.isEmpty() ? 0 : numbers.stream().mapToDouble(Double::doubleValue).max().getAsDouble());
        });

        // Logic
        registry.register("IF", 2, 3, args -> {
            boolean condition = bool("IF", args.get(0).getValue());
            if (condition) {
                return EvaluationResult.of(args.get(1).getValue());
            }
            return EvaluationResult.of(args.size() > 2 ? args.get(2).getValue() : CellValue.bool(false));
        });
        registry.registerAggregate("AND", 1, VARIADIC, args -> {
            List<Boolean> conditions = booleans("AND", args);
            return EvaluationResult.of(CellValue.bool(conditions.stream().allMatch(Boolean::booleanValue)));
        });
        registry.registerAggregate("OR", 1, VARIADIC, args -> {
            List<Boolean> conditions = booleans("OR", args);
            return EvaluationResult.of(CellValue.bool(conditions.stream().anyMatch(Boolean::booleanValue)));
        });
        registry.register("NOT", 1, 1, args -> EvaluationResult.of(CellValue.bool(!bool("NOT", args.get(0).getValue()))));
        registry.register("ISBLANK", 1, 1, args -> EvaluationResult.of(CellValue.bool(args.get(0).getValue().isEmpty())));

        // Math
        registry.register("ABS", 1, 1, args -> EvaluationResult.number(Math.abs(number("ABS", args.get(0)))));
        registry.register("SQRT", 1, 1, args -> {
            double n = number("SQRT", args.get(0));
            if (n < 0) {
                return EvaluationResult.error(ErrorKind.NUM, "SQRT of a negative number");
            }
            return EvaluationResult.number(Math.sqrt(n));
        });
        registry.register("POWER", 2, 2, args -> power(number("POWER", args.get(0)), number("POWER", args.get(1))));
        registry.register("ROUND", 1, 2, args -> {
            double n = number("ROUND", args.get(0));
            double requested = args.size() > 1 ? number("ROUND", args.get(1)) : 0;
            int digits = (int) Math.max(-308, Math.min(308, requested));
            return EvaluationResult.number(BigDecimal.valueOf(n).setScale(digits, RoundingMode.HALF_UP).doubleValue());
        });
        registry.register("PI", 0, 0, args -> EvaluationResult.number(Math.PI));

        // Text
        registry.register("CONCATENATE", 1, VARIADIC, args -> {
            StringBuilder text = new StringBuilder();
            for (FunctionArgument arg : args) {
                text.append(ValueCoercion.toText(arg.getValue()));
            }
            return EvaluationResult.of(CellValue.text(text.toString()));
        });
        registry.register("LEN", 1, 1, args -> EvaluationResult.number(text(args.get(0)).length()));
        registry.register("UPPER", 1, 1, args -> EvaluationResult.of(CellValue.text(text(args.get(0)).toUpperCase())));
        registry.register("LOWER", 1, 1, args -> EvaluationResult.of(CellValue.text(text(args.get(0)).toLowerCase())));
        registry.register("LEFT", 1, 2, args -> {
            String text = text(args.get(0));
            int count = args.size() > 1 ? count("LEFT", args.get(1)) : 1;
            return EvaluationResult.of(CellValue.text(text.substring(0, Math.min(count, text.length()))));
        });
        registry.register("RIGHT", 1, 2, args -> {
            String text = text(args.get(0));
            int count = args.size() > 1 ? count("RIGHT", args.get(1)) : 1;
            return EvaluationResult.of(CellValue.text(text.substring(text.length() - Math.min(count, text.length()))));
        });
        registry.register("MID", 3, 3, args -> {
            String text = text(args.get(0));
            int start = (int) number("MID", args.get(1));
            int length = count("MID", args.get(2));
            if (start < 1) {
                throw new FunctionArgumentException(ErrorKind.VALUE, "MID start must be at least 1");
            }
            int from = Math.min(start - 1, text.length());
            int to = (int) Math.min((long) from + length, text.length());
            return EvaluationResult.of(CellValue.text(text.substring(from, to)));
        });
    }

    /**
     * Shared by the ^ operator and POWER().
     */
    static EvaluationResult power(double base, double exponent) {
        if (base == 0 && exponent < 0) {
            return EvaluationResult.error(ErrorKind.DIV_ZERO, "Zero raised to a negative power");
        }
        return EvaluationResult.number(Math.pow(base, exponent));
    }

    private static List<Double> numbers(String function, List<FunctionArgument> args) {
        List<Double> numbers = new ArrayList<>();
        for (FunctionArgument arg : args) {
            if (arg.isRange()) {
                for (CellValue value : arg.getValues()) {
                    if (value instanceof CellValue.NumberValue) {
                        numbers.add(((CellValue.NumberValue) value).getValue());
                    }
                }
            } else if (!arg.getValue().isEmpty()) {
                numbers.add(number(function, arg));
            }
        }
        return numbers;
    }

    private static List<Boolean> booleans(String function, List<FunctionArgument> args) {
        List<Boolean> conditions = new ArrayList<>();
        for (FunctionArgument arg : args) {
            if (arg.isRange()) {
                for (CellValue value : arg.getValues()) {
                    if (value instanceof CellValue.BooleanValue || value instanceof CellValue.NumberValue) {
                        conditions.add(ValueCoercion.toBoolean(value));
                    }
                }
            } else {
                conditions.add(bool(function, arg.getValue()));
            }
        }
        if (conditions.isEmpty()) {
            throw new FunctionArgumentException(ErrorKind.VALUE, function + " found no logical values");
        }
        return conditions;
    }

    private static double number(String function, FunctionArgument arg) {
        Double number = ValueCoercion.toNumber(arg.getValue());
        if (number == null) {
            throw new FunctionArgumentException(ErrorKind.VALUE,
                    function + " expects a number, got " + describe(arg.getValue()));
        }
        return number;
    }

    private static int count(String function, FunctionArgument arg) {
        double n = number(function, arg);
        if (n < 0) {
            throw new FunctionArgumentException(ErrorKind.VALUE, function + " length must not be negative");
        }
        return n > Integer.MAX_VALUE ? Integer.MAX_VALUE : (int) n;
    }

    private static boolean bool(String function, CellValue value) {
        Boolean bool = ValueCoercion.toBoolean(value);
        if (bool == null) {
            throw new FunctionArgumentException(ErrorKind.VALUE,
                    function + " expects a logical value, got " + describe(value));
        }
        return bool;
    }

    private static String text(FunctionArgument arg) {
        return ValueCoercion.toText(arg.getValue());
    }

    private static String describe(CellValue value) {
        return value.getType().name().toLowerCase() + " '" + ValueCoercion.toText(value) + "'";
    }
}
