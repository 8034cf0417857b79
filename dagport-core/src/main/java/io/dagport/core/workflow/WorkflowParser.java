package io.dagport.core.workflow;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import com.google.common.base.Optional;
import com.google.common.collect.LinkedHashMultimap;
import com.google.common.collect.SetMultimap;
import com.google.inject.Inject;
import io.dagport.core.config.XmlElements;
import io.dagport.core.mapper.MapperRegistry;
import io.dagport.spi.EdgeKind;
import io.dagport.spi.MappingContext;
import io.dagport.spi.NodeMapper;
import io.dagport.spi.Relation;
import io.dagport.spi.Task;
import io.dagport.spi.Translation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Element;

/**
 * Walks a workflow from its start node along every transition, translating
 * each reachable node once and linking the last task of a node to the first
 * task of its successor.
 */
public class WorkflowParser
{
    private static final Logger logger = LoggerFactory.getLogger(WorkflowParser.class);

    public static final String START_NODE_NAME = "start";

    private final MapperRegistry registry;

    @Inject
    public WorkflowParser(MapperRegistry registry)
    {
        this.registry = registry;
    }

    public Workflow parse(String workflowName, Element root, Map<String, String> params)
    {
        return new Context(workflowName, root, params).parse();
    }

    private static class Transition
    {
        private final String from;
        private final String to;
        private final EdgeKind kind;

        Transition(String from, String to, EdgeKind kind)
        {
            this.from = from;
            this.to = to;
            this.kind = kind;
        }
    }

    private class Context
    {
        private final Workflow workflow;
        private final Element root;
        private final Map<String, String> params;
        private final Map<String, Element> elements = new LinkedHashMap<>();
        private final Map<String, NodeType> types = new HashMap<>();
        private final List<Transition> transitions = new ArrayList<>();

        Context(String workflowName, Element root, Map<String, String> params)
        {
            this.workflow = new Workflow(workflowName);
            this.root = root;
            this.params = params;
        }

        Workflow parse()
        {
            indexElements();
            translateReachableNodes();
            checkTaskIds();
            checkCycles();
            List<String> forks = workflow.getNodes().stream()
                .filter(node -> node.getNodeType() == NodeType.FORK)
                .map(ParsedNode::getName)
                .collect(Collectors.toList());
            workflow.setForkJoins(new ForkJoinAnalyzer(types, successors(true)).analyze(forks));
            resolveRelations();
            return workflow;
        }

        private void indexElements()
        {
            GraphValidator validator = GraphValidator.builder();
            for (Element element : XmlElements.children(root)) {
                String tag = XmlElements.localName(element);
                Optional<NodeType> type = NodeType.ofTag(tag);
                if (!type.isPresent()) {
                    logger.debug("Skipping <{}> element which is not a workflow node", tag);
                    continue;
                }
                String name = type.get() == NodeType.START ? START_NODE_NAME : element.getAttribute("name");
                if (name.isEmpty()) {
                    validator.error("<" + tag + ">", "must have a name attribute");
                    continue;
                }
                if (elements.containsKey(name)) {
                    validator.error(name, "is defined more than once");
                    continue;
                }
                elements.put(name, element);
                types.put(name, type.get());
            }
            validator.check(START_NODE_NAME, types.get(START_NODE_NAME) == NodeType.START, "must be defined");
            validator.validate("workflow nodes");
        }

        private void translateReachableNodes()
        {
            GraphValidator validator = GraphValidator.builder();
            Deque<String> queue = new ArrayDeque<>();
            Set<String> queued = new HashSet<>();
            queue.add(START_NODE_NAME);
            queued.add(START_NODE_NAME);

            while (!queue.isEmpty()) {
                String name = queue.poll();
                Element element = elements.get(name);
                NodeType type = types.get(name);

                Optional<ParsedNode> node = translate(name, type, element, validator);
                if (node.isPresent()) {
                    workflow.addNode(node.get());
                }

                for (Transition transition : collectTransitions(name, type, element, validator)) {
                    if (!elements.containsKey(transition.to)) {
                        validator.error(name, "has a transition to undefined node '%s'", transition.to);
                        continue;
                    }
                    transitions.add(transition);
                    if (queued.add(transition.to)) {
                        queue.add(transition.to);
                    }
                }
            }
            validator.validate("workflow transitions");

            List<String> unreachable = elements.keySet().stream()
                .filter(name -> !queued.contains(name))
                .collect(Collectors.toList());
            if (!unreachable.isEmpty()) {
                logger.warn("Nodes {} of workflow {} are not reachable from the start node. Ignoring them", unreachable, workflow.getName());
            }
        }

        private Optional<ParsedNode> translate(String name, NodeType type, Element element, GraphValidator validator)
        {
            Element body = element;
            String mapperType;
            Optional<NodeMapper> mapper;
            if (type == NodeType.ACTION) {
                Optional<Element> actionBody = actionBody(element);
                if (!actionBody.isPresent()) {
                    validator.error(name, "has no action body");
                    return Optional.absent();
                }
                body = actionBody.get();
                mapperType = XmlElements.localName(body);
                mapper = registry.getActionMapper(mapperType);
            }
            else {
                mapperType = type.getTag();
                mapper = registry.get(mapperType);
            }
            if (!mapper.isPresent()) {
                validator.error(name, "has no mapper for type '%s'", mapperType);
                return Optional.absent();
            }

            Translation translation;
            try {
                translation = mapper.get().translate(new MappingContext(name, body, params));
            }
            catch (RuntimeException ex) {
                throw new MappingException(name, mapperType, ex);
            }
            if (translation.getTasks().isEmpty()) {
                validator.error(name, "was translated into no tasks");
                return Optional.absent();
            }

            logger.debug("Translated node {} ({}) into tasks {}", name, mapperType,
                    translation.getTasks().stream().map(Task::getTaskId).collect(Collectors.toList()));
            return Optional.of(new ParsedNode(name, type, mapperType, mapper.get().isPassthrough(), translation));
        }

        private Optional<Element> actionBody(Element action)
        {
            for (Element child : XmlElements.children(action)) {
                String tag = XmlElements.localName(child);
                if (!tag.equals("ok") && !tag.equals("error")) {
                    return Optional.of(child);
                }
            }
            return Optional.absent();
        }

        private List<Transition> collectTransitions(String name, NodeType type, Element element, GraphValidator validator)
        {
            List<Transition> list = new ArrayList<>();
            switch (type) {
            case START:
            case JOIN:
                addTarget(list, validator, name, element, "to", EdgeKind.NORMAL);
                break;
            case END:
            case KILL:
                break;
            case ACTION:
                Optional<Element> ok = XmlElements.child(element, "ok");
                if (ok.isPresent()) {
                    addTarget(list, validator, name, ok.get(), "to", EdgeKind.NORMAL);
                }
                else {
                    validator.error(name, "must declare an <ok> transition");
                }
                Optional<Element> error = XmlElements.child(element, "error");
                if (error.isPresent()) {
                    addTarget(list, validator, name, error.get(), "to", EdgeKind.ERROR);
                }
                break;
            case DECISION:
                Optional<Element> switchElement = XmlElements.child(element, "switch");
                if (!switchElement.isPresent()) {
                    validator.error(name, "must have a <switch> element");
                    break;
                }
                for (Element caseElement : XmlElements.children(switchElement.get(), "case")) {
                    addTarget(list, validator, name, caseElement, "to", EdgeKind.NORMAL);
                }
                Optional<Element> defaultElement = XmlElements.child(switchElement.get(), "default");
                if (defaultElement.isPresent()) {
                    addTarget(list, validator, name, defaultElement.get(), "to", EdgeKind.NORMAL);
                }
                else {
                    validator.error(name, "must declare a default transition");
                }
                break;
            case FORK:
                List<Element> paths = XmlElements.children(element, "path");
                validator.check(name, paths.size() >= 2, "must have at least 2 paths but has %d", paths.size());
                for (Element path : paths) {
                    addTarget(list, validator, name, path, "start", EdgeKind.NORMAL);
                }
                break;
            default:
                throw new AssertionError("Unknown node type: " + type);
            }
            return list;
        }

        private void addTarget(List<Transition> list, GraphValidator validator,
                String name, Element element, String attribute, EdgeKind kind)
        {
            Optional<String> target = XmlElements.attribute(element, attribute);
            if (!target.isPresent() || target.get().isEmpty()) {
                validator.error(name, "has <%s> without '%s' attribute", XmlElements.localName(element), attribute);
                return;
            }
            list.add(new Transition(name, target.get(), kind));
        }

        private void checkTaskIds()
        {
            GraphValidator validator = GraphValidator.builder();
            Map<String, String> owners = new HashMap<>();
            for (ParsedNode node : workflow.getNodes()) {
                for (Task task : node.getTasks()) {
                    String owner = owners.putIfAbsent(task.getTaskId(), node.getName());
                    if (owner != null) {
                        validator.error(node.getName(), "produces task id '%s' which is already produced by node '%s'", task.getTaskId(), owner);
                    }
                }
                for (Relation relation : node.getInternalRelations()) {
                    validator.check(node.getName(), node.hasTask(relation.getFrom()) && node.hasTask(relation.getTo()),
                            "has an internal relation %s referring to a task it does not produce", relation);
                }
            }
            validator.validate("task ids");
        }

        private void checkCycles()
        {
            GraphValidator validator = GraphValidator.builder();
            SetMultimap<String, String> successors = successors(false);
            Set<String> done = new HashSet<>();
            List<String> path = new ArrayList<>();
            for (String name : workflow.getNodeNames()) {
                visit(name, successors, done, path, validator);
            }
            validator.validate("workflow cycles");
        }

        private void visit(String name, SetMultimap<String, String> successors,
                Set<String> done, List<String> path, GraphValidator validator)
        {
            if (done.contains(name)) {
                return;
            }
            int index = path.indexOf(name);
            if (index >= 0) {
                List<String> cycle = new ArrayList<>(path.subList(index, path.size()));
                cycle.add(name);
                validator.error(name, "is part of a cycle %s", String.join(" -> ", cycle));
                return;
            }
            path.add(name);
            for (String next : successors.get(name)) {
                visit(next, successors, done, path, validator);
            }
            path.remove(path.size() - 1);
            done.add(name);
        }

        private SetMultimap<String, String> successors(boolean successPathOnly)
        {
            SetMultimap<String, String> map = LinkedHashMultimap.create();
            for (Transition transition : transitions) {
                if (!successPathOnly || !transition.kind.isFailurePath()) {
                    map.put(transition.from, transition.to);
                }
            }
            return map;
        }

        private void resolveRelations()
        {
            GraphValidator validator = GraphValidator.builder();
            for (ParsedNode node : workflow.getNodes()) {
                for (Relation relation : node.getInternalRelations()) {
                    workflow.addRelation(relation);
                }
            }
            for (Transition transition : transitions) {
                ParsedNode from = workflow.getNode(transition.from).get();
                ParsedNode to = workflow.getNode(transition.to).get();
                try {
                    workflow.addRelation(Relation.of(from.getLastTaskId(), to.getFirstTaskId(), transition.kind));
                }
                catch (IllegalStateException ex) {  // thrown by Relation.check
                    validator.error(transition.from, "%s", ex.getMessage());
                }
            }
            validator.validate("relations");
        }
    }
}
