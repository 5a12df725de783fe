package tech.yump.awsengine.secrets.aws.naming.template;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Immutable parse tree of a username template. Nodes write output; expressions produce values.
 */
final class TemplateNodes {

    private TemplateNodes() {
    }

    /**
     * What a node or expression can see while rendering.
     */
    record Scope(TemplateContext context, TemplateFunctions functions) {}

    interface Node {
        void render(Scope scope, StringBuilder out);
    }

    interface Expression {
        Object evaluate(Scope scope);
    }

    record Text(String text) implements Node {
        @Override
        public void render(Scope scope, StringBuilder out) {
            out.append(text);
        }
    }

    record Action(Expression pipeline) implements Node {
        @Override
        public void render(Scope scope, StringBuilder out) {
            out.append(TemplateFunctions.display(pipeline.evaluate(scope)));
        }
    }

    record Branch(Expression condition, List<Node> body) {}

    /**
     * {@code if} / {@code else if} chain with an optional final {@code else}.
     */
    record If(List<Branch> branches, List<Node> otherwise) implements Node {
        @Override
        public void render(Scope scope, StringBuilder out) {
            for (Branch branch : branches) {
                if (TemplateFunctions.isTruthy(branch.condition().evaluate(scope))) {
                    branch.body().forEach(node -> node.render(scope, out));
                    return;
                }
            }
            otherwise.forEach(node -> node.render(scope, out));
        }
    }

    record Field(String name) implements Expression {
        @Override
        public Object evaluate(Scope scope) {
            return scope.context().field(name);
        }
    }

    record Literal(Object value) implements Expression {
        @Override
        public Object evaluate(Scope scope) {
            return value;
        }
    }

    /**
     * One stage of a pipeline. A command either calls {@code function} with its arguments, or
     * (when {@code function} is null) yields its single operand.
     */
    record Command(String function, List<Expression> arguments) implements Expression {

        @Override
        public Object evaluate(Scope scope) {
            return execute(scope, List.of());
        }

        Object execute(Scope scope, List<Object> piped) {
            if (function == null) {
                if (!piped.isEmpty()) {
                    throw new TemplateRenderException("can't give argument to non-function");
                }
                return arguments.get(0).evaluate(scope);
            }
            if ("and".equals(function) || "or".equals(function)) {
                return shortCircuit(scope, piped);
            }
            List<Object> values = new ArrayList<>(arguments.size() + piped.size());
            for (Expression argument : arguments) {
                values.add(argument.evaluate(scope));
            }
            values.addAll(piped);
            return scope.functions().call(function, values);
        }

        /**
         * {@code and} stops at the first falsy argument, {@code or} at the first truthy one.
         * Later arguments are not evaluated.
         */
        private Object shortCircuit(Scope scope, List<Object> piped) {
            if (arguments.isEmpty() && piped.isEmpty()) {
                return scope.functions().call(function, List.of());
            }
            boolean stopWhen = "or".equals(function);
            Object value = null;
            for (Expression argument : arguments) {
                value = argument.evaluate(scope);
                if (TemplateFunctions.isTruthy(value) == stopWhen) {
                    return value;
                }
            }
            for (Object pipedValue : piped) {
                value = pipedValue;
                if (TemplateFunctions.isTruthy(value) == stopWhen) {
                    return value;
                }
            }
            return value;
        }
    }

    /**
     * Commands joined by {@code |}; each result is passed as the last argument of the next.
     */
    record Pipeline(List<Command> commands) implements Expression {
        @Override
        public Object evaluate(Scope scope) {
            Object value = commands.get(0).execute(scope, List.of());
            for (Command command : commands.subList(1, commands.size())) {
                value = command.execute(scope, Collections.singletonList(value));
            }
            return value;
        }
    }
}
