package io.dagport.standards.mapper;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import com.google.common.base.Optional;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import io.dagport.core.config.ElResolver;
import io.dagport.core.config.XmlElements;
import io.dagport.spi.ImmutableTask;
import io.dagport.spi.MappingContext;
import io.dagport.spi.NodeMapper;
import io.dagport.spi.Task;
import io.dagport.spi.Translation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Element;

/**
 * Translates a decision node into a branching task. Case predicates are kept
 * as strings with known parameters substituted; the first case whose
 * predicate reads {@code true} at run time is taken, otherwise the default.
 * <p>
 * A missing {@code <switch>} or {@code <default>} is reported by the workflow
 * parser, so this mapper doesn't check for it.
 */
public class DecisionMapper
        implements NodeMapper
{
    private static final Logger logger = LoggerFactory.getLogger(DecisionMapper.class);

    @Override
    public String getType()
    {
        return "decision";
    }

    @Override
    public Translation translate(MappingContext context)
    {
        List<Map<String, String>> branches = new ArrayList<>();
        Optional<String> defaultTarget = Optional.absent();

        Optional<Element> switchElement = XmlElements.child(context.getElement(), "switch");
        if (switchElement.isPresent()) {
            for (Element caseElement : XmlElements.children(switchElement.get(), "case")) {
                branches.add(ImmutableMap.of(
                            "predicate", ElResolver.resolve(XmlElements.text(caseElement), context.getParams()),
                            "target", caseElement.getAttribute("to")));
            }
            defaultTarget = XmlElements.child(switchElement.get(), "default")
                .transform(element -> element.getAttribute("to"));
        }

        ImmutableTask.Builder builder = Task.builder()
            .taskId(context.getTaskId())
            .templateName("decision.tpl")
            .putTemplateParams("branches", branches)
            .putTemplateParams("default_target", defaultTarget.or(""));
        for (Map<String, String> branch : branches) {
            builder.addReferencedNodes(branch.get("target"));
        }
        if (defaultTarget.isPresent()) {
            builder.addReferencedNodes(defaultTarget.get());
        }
        Task task = builder.build();
        logger.debug("Decision {} has {} cases, default {}", context.getNodeName(), branches.size(), defaultTarget.or("(none)"));
        return Translation.of(task, ImmutableSet.of(AirflowImports.PYTHON_OPERATOR));
    }
}
