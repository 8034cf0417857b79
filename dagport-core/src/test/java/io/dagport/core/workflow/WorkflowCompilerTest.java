package io.dagport.core.workflow;

import java.util.List;
import java.util.stream.Collectors;
import com.google.common.collect.ImmutableSet;
import io.dagport.spi.EdgeKind;
import io.dagport.spi.Relation;
import io.dagport.spi.Task;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;

import static io.dagport.core.workflow.WorkflowTestingUtils.NO_PARAMS;
import static io.dagport.core.workflow.WorkflowTestingUtils.loadWorkflow;
import static io.dagport.core.workflow.WorkflowTestingUtils.policyOf;
import static io.dagport.spi.TriggerPolicy.ALL_UPSTREAM_DONE;
import static io.dagport.spi.TriggerPolicy.ALL_UPSTREAM_SUCCEEDED;
import static io.dagport.spi.TriggerPolicy.ANY_UPSTREAM_FAILED;
import static io.dagport.spi.TriggerPolicy.ANY_UPSTREAM_SUCCEEDED_OR_SKIPPED;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.hasItem;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.not;

public class WorkflowCompilerTest
{
    @Rule public ExpectedException exception = ExpectedException.none();

    private WorkflowCompiler compiler;

    @Before
    public void setUp()
    {
        compiler = WorkflowTestingUtils.newCompiler();
    }

    private CompiledWorkflow compile(String name)
    {
        return compiler.compile(name, loadWorkflow(name), NO_PARAMS);
    }

    private static List<String> taskIds(CompiledWorkflow workflow)
    {
        return workflow.getTasks().stream()
            .map(Task::getTaskId)
            .collect(Collectors.toList());
    }

    private static long incomingCount(CompiledWorkflow workflow, String taskId)
    {
        return workflow.getRelations().stream()
            .filter(relation -> relation.getTo().equals(taskId))
            .count();
    }

    @Test
    public void errorTransitionLeadsToKill()
    {
        CompiledWorkflow wf = compile("scenario_a");

        assertThat(taskIds(wf), contains("A", "end", "kill"));
        assertThat(wf.getRelations(), is(ImmutableSet.of(
                Relation.of("A", "end", EdgeKind.NORMAL),
                Relation.of("A", "kill", EdgeKind.ERROR))));
        assertThat(policyOf(wf, "A"), is(ALL_UPSTREAM_SUCCEEDED));
        assertThat(policyOf(wf, "end"), is(ALL_UPSTREAM_SUCCEEDED));
        assertThat(policyOf(wf, "kill"), is(ANY_UPSTREAM_FAILED));
        assertThat(wf.getEntryTaskIds(), contains("A"));
    }

    @Test
    public void startNodeIsElided()
    {
        CompiledWorkflow wf = compile("scenario_a");

        assertThat(wf.getNode("start").isPresent(), is(false));
        assertThat(wf.getTask("start").isPresent(), is(false));
    }

    @Test
    public void multiTaskNodeIsLinkedThroughFirstAndLastTask()
    {
        CompiledWorkflow wf = compile("scenario_b");

        assertThat(taskIds(wf), contains("X_prepare", "X", "end"));
        assertThat(wf.getRelations(), is(ImmutableSet.of(
                Relation.of("X_prepare", "X", EdgeKind.STRUCTURAL),
                Relation.of("X", "end", EdgeKind.NORMAL))));
        assertThat(policyOf(wf, "X_prepare"), is(ALL_UPSTREAM_SUCCEEDED));
        assertThat(policyOf(wf, "X"), is(ALL_UPSTREAM_SUCCEEDED));
        assertThat(wf.getEntryTaskIds(), contains("X_prepare"));
        assertThat(wf.getNode("X").get().getMapperType(), is("prepared"));
    }

    @Test
    public void decisionArmsConvergeWithSucceededOrSkipped()
    {
        CompiledWorkflow wf = compile("scenario_c");

        assertThat(policyOf(wf, "D"), is(ALL_UPSTREAM_SUCCEEDED));
        assertThat(policyOf(wf, "N1"), is(ALL_UPSTREAM_SUCCEEDED));
        assertThat(policyOf(wf, "N2"), is(ALL_UPSTREAM_SUCCEEDED));
        assertThat(policyOf(wf, "N3"), is(ALL_UPSTREAM_SUCCEEDED));
        assertThat(policyOf(wf, "M"), is(ANY_UPSTREAM_SUCCEEDED_OR_SKIPPED));
        assertThat(policyOf(wf, "end"), is(ALL_UPSTREAM_SUCCEEDED));
        assertThat(wf.getRelations(), hasItem(Relation.of("D", "N3", EdgeKind.NORMAL)));
        assertThat(wf.getEntryTaskIds(), contains("D"));
    }

    @Test
    public void decisionArmsEndingAtEndNode()
    {
        CompiledWorkflow wf = compile("decision_to_end");

        assertThat(policyOf(wf, "end"), is(ANY_UPSTREAM_SUCCEEDED_OR_SKIPPED));
        assertThat(policyOf(wf, "A"), is(ALL_UPSTREAM_SUCCEEDED));
    }

    @Test
    public void mixedIncomingRelationsWaitForAll()
    {
        CompiledWorkflow wf = compile("scenario_d");

        assertThat(wf.getRelations(), is(ImmutableSet.of(
                Relation.of("A", "B", EdgeKind.NORMAL),
                Relation.of("A", "C", EdgeKind.ERROR),
                Relation.of("B", "C", EdgeKind.NORMAL),
                Relation.of("C", "end", EdgeKind.NORMAL))));
        assertThat(policyOf(wf, "B"), is(ALL_UPSTREAM_SUCCEEDED));
        assertThat(policyOf(wf, "C"), is(ALL_UPSTREAM_DONE));
    }

    @Test
    public void forkJoinWaitsForAllPaths()
    {
        CompiledWorkflow wf = compile("fork_join");

        assertThat(policyOf(wf, "J"), is(ALL_UPSTREAM_SUCCEEDED));
        assertThat(policyOf(wf, "kill"), is(ANY_UPSTREAM_FAILED));
        assertThat(wf.getRelations(), hasItem(Relation.of("F", "P2", EdgeKind.NORMAL)));
        assertThat(wf.getEntryTaskIds(), contains("F"));
        assertThat(incomingCount(wf, "J"), is(3L));
    }

    @Test
    public void nestedJoinsReceiveOneRelationPerPath()
    {
        CompiledWorkflow wf = compile("nested_fork");

        assertThat(incomingCount(wf, "J2"), is(2L));
        assertThat(incomingCount(wf, "J1"), is(2L));
        assertThat(wf.getRelations(), hasItem(Relation.of("J2", "J1", EdgeKind.NORMAL)));
        assertThat(policyOf(wf, "J1"), is(ALL_UPSTREAM_SUCCEEDED));
        assertThat(wf.getEntryTaskIds(), contains("F1"));
    }

    @Test
    public void okAndErrorToSameNodeKeepBothKinds()
    {
        CompiledWorkflow wf = compile("ok_and_error_same_target");

        assertThat(wf.getRelations(), is(ImmutableSet.of(
                Relation.of("A", "C", EdgeKind.NORMAL),
                Relation.of("A", "C", EdgeKind.ERROR),
                Relation.of("C", "end", EdgeKind.NORMAL))));
        assertThat(policyOf(wf, "C"), is(ALL_UPSTREAM_DONE));
        assertThat(policyOf(wf, "A"), is(ALL_UPSTREAM_SUCCEEDED));
    }

    @Test
    public void joinAfterDecisionInsideForkIsConvergence()
    {
        CompiledWorkflow wf = compile("decision_in_fork");

        assertThat(policyOf(wf, "J"), is(ANY_UPSTREAM_SUCCEEDED_OR_SKIPPED));
        assertThat(policyOf(wf, "P"), is(ALL_UPSTREAM_SUCCEEDED));
        assertThat(policyOf(wf, "end"), is(ALL_UPSTREAM_SUCCEEDED));
    }

    @Test
    public void unknownActionFallsBackToDummy()
    {
        CompiledWorkflow wf = compile("unknown_action");

        CompiledNode node = wf.getNode("hive-step").get();
        assertThat(node.getMapperType(), is("hive"));
        assertThat(node.getTasks().get(0).getTaskId(), is("hive_step"));
        assertThat(wf.getDependencies(), hasItem(FixtureMapper.importOf("dummy")));
    }

    @Test
    public void unreachableNodesAndNonNodeElementsAreIgnored()
    {
        CompiledWorkflow wf = compile("unreachable");

        assertThat(taskIds(wf), contains("A", "end"));
        assertThat(wf.getNode("orphan").isPresent(), is(false));
    }

    @Test
    public void errorEdgeIntoMarkerKeepsFailurePolicy()
    {
        CompiledWorkflow wf = compile("error_marker");

        assertThat(wf.getNode("M").isPresent(), is(false));
        assertThat(wf.getRelations(), is(ImmutableSet.of(
                Relation.of("A", "end", EdgeKind.NORMAL),
                Relation.of("A", "kill", EdgeKind.ERROR))));
        assertThat(policyOf(wf, "kill"), is(ANY_UPSTREAM_FAILED));
    }

    @Test
    public void dependenciesAreCollectedFromRemainingNodes()
    {
        CompiledWorkflow wf = compile("scenario_a");

        assertThat(wf.getDependencies(), contains(
                FixtureMapper.importOf("noop"),
                FixtureMapper.importOf("end"),
                FixtureMapper.importOf("kill")));
        assertThat(wf.getDependencies(), not(hasItem(FixtureMapper.importOf("start"))));
    }

    @Test
    public void compilationIsRepeatable()
    {
        CompiledWorkflow first = compile("scenario_c");
        CompiledWorkflow second = compile("scenario_c");

        assertThat(second, is(first));
    }

    @Test
    public void rejectCycle()
    {
        exception.expect(StructuralException.class);
        exception.expectMessage(containsString("is part of a cycle"));
        compile("cycle");
    }

    @Test
    public void rejectMarkerWithTwoSuccessors()
    {
        exception.expect(StructuralException.class);
        exception.expectMessage(containsString("must have exactly one outgoing relation but has 2"));
        compile("marker_fan_out");
    }

    @Test
    public void mapperFailureIsWrapped()
    {
        exception.expect(MappingException.class);
        exception.expectMessage(containsString("Failed to translate node 'A' of type failing"));
        compile("failing_mapper");
    }
}
