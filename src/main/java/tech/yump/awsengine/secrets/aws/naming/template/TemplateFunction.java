package tech.yump.awsengine.secrets.aws.naming.template;

import java.util.List;

/**
 * A callable exposed to username templates. Arguments arrive already evaluated, with a piped
 * value (if any) as the last element.
 */
@FunctionalInterface
interface TemplateFunction {

    Object apply(List<Object> args) throws TemplateRenderException;
}
