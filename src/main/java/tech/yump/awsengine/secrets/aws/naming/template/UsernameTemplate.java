package tech.yump.awsengine.secrets.aws.naming.template;

import java.util.List;
import java.util.Objects;

/**
 * A parsed username template, bound to the function registry it was parsed against.
 * Instances are immutable and may be rendered concurrently.
 */
public final class UsernameTemplate {

    private final List<TemplateNodes.Node> nodes;
    private final TemplateFunctions functions;

    private UsernameTemplate(List<TemplateNodes.Node> nodes, TemplateFunctions functions) {
        this.nodes = nodes;
        this.functions = functions;
    }

    /**
     * Parses template text.
     *
     * @throws TemplateRenderException if the text is not a valid template or calls an undefined function.
     */
    public static UsernameTemplate parse(String source, TemplateFunctions functions) {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(functions, "functions");
        return new UsernameTemplate(new TemplateParser(source, functions).parse(), functions);
    }

    /**
     * Renders against the given context. Leading and trailing whitespace is removed from the
     * result so that multi-line templates produce bare names.
     *
     * @throws TemplateRenderException if an undefined field is referenced or a function rejects its arguments.
     */
    public String render(TemplateContext context) {
        TemplateNodes.Scope scope = new TemplateNodes.Scope(context, functions);
        StringBuilder out = new StringBuilder();
        try {
            for (TemplateNodes.Node node : nodes) {
                node.render(scope, out);
            }
        } catch (TemplateRenderException e) {
            throw new TemplateRenderException("unable to render username template: " + e.getMessage(), e);
        }
        return out.toString().strip();
    }
}
