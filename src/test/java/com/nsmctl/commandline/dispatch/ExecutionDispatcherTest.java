package com.nsmctl.commandline.dispatch;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.Set;

import org.junit.jupiter.api.Test;

import com.nsmctl.commandline.descriptor.DescriptorExtractor;
import com.nsmctl.commandline.descriptor.OperationDeclaration;
import com.nsmctl.commandline.descriptor.ReservedNames;
import com.nsmctl.commandline.descriptor.SemanticType;
import com.nsmctl.commandline.descriptor.TargetDescriptor;
import com.nsmctl.commandline.descriptor.TargetType;
import com.nsmctl.commandline.iface.ParsedArguments;

import static org.assertj.core.api.Assertions.*;

class ExecutionDispatcherTest {

    record Greeter(String name) {
    }

    private static final TargetType<Greeter> GREETER = TargetType.<Greeter>builder("Greeter")
            .constructorParameter("name", SemanticType.string())
            .factory(args -> new Greeter(args.getString("name")))
            .operation(OperationDeclaration.<Greeter>builder("greet")
                    .parameter("greeting", SemanticType.string())
                    .invoker((target, args) -> args.getString("greeting") + ", " + target.name())
                    .build())
            .operation(OperationDeclaration.<Greeter>builder("quiet")
                    .invoker((target, args) -> null)
                    .build())
            .build();

    private final StringWriter out = new StringWriter();
    private final ExecutionDispatcher dispatcher = new ExecutionDispatcher(new PrintWriter(out));

    @Test
    void testPartition() {
        ParsedArguments values = ParsedArguments.of("name", "sensor", "greeting", "hello",
                "action", "greet", "sub_interface", "greeter");

        ArgumentPartition partition = dispatcher.partition(values, Set.of("name"), ReservedNames.DEFAULTS);

        assertThat(partition.constructorArguments().names()).containsExactly("name");
        assertThat(partition.operationArguments().names()).containsExactly("greeting");
    }

    @Test
    void testDispatchPrintsResult() throws Exception {
        TargetDescriptor<Greeter> target = new DescriptorExtractor().extract(GREETER);
        ArgumentPartition partition = new ArgumentPartition(ParsedArguments.of("name", "sensor"),
                ParsedArguments.of("greeting", "hello"));

        Object result = dispatcher.dispatch(target, "greet", partition, true);

        assertThat(result).isEqualTo("hello, sensor");
        assertThat(out.toString()).isEqualToIgnoringNewLines("hello, sensor");
    }

    @Test
    void testNullResultIsNotPrinted() throws Exception {
        TargetDescriptor<Greeter> target = new DescriptorExtractor().extract(GREETER);

        Object result = dispatcher.dispatch(target, "quiet",
                new ArgumentPartition(ParsedArguments.of("name", "x"), ParsedArguments.empty()), true);

        assertThat(result).isNull();
        assertThat(out.toString()).isEmpty();
    }

    @Test
    void testResultNotPrintedUnlessAsked() throws Exception {
        TargetDescriptor<Greeter> target = new DescriptorExtractor().extract(GREETER);

        dispatcher.dispatch(target, "greet", new ArgumentPartition(ParsedArguments.of("name", "x"),
                ParsedArguments.of("greeting", "hi")), false);

        assertThat(out.toString()).isEmpty();
    }
}
