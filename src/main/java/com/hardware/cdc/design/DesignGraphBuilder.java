package com.hardware.cdc.design;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.hardware.cdc.ast.AlwaysNode;
import com.hardware.cdc.ast.AssignmentNode;
import com.hardware.cdc.ast.ConcatNode;
import com.hardware.cdc.ast.IdentifierNode;
import com.hardware.cdc.ast.IndexNode;
import com.hardware.cdc.ast.ModuleDefNode;
import com.hardware.cdc.ast.NetDeclNode;
import com.hardware.cdc.ast.PortDeclNode;
import com.hardware.cdc.ast.PortNode;
import com.hardware.cdc.ast.RegDeclNode;
import com.hardware.cdc.ast.SourceNode;
import com.hardware.cdc.ast.SyntaxNode;
import com.hardware.cdc.ast.SyntaxTreeScanner;
import com.hardware.cdc.core.context.ToolDiagnostics;

/**
 * Builds a {@link DesignGraph} from a parsed source tree.
 *
 * Each call walks the tree with a fresh walker that threads a
 * {@link BuildContext} (current module, current clock) down the tree, so one
 * builder can be shared between runs.
 *
 * Assignments are resolved against the registers of the enclosing module:
 * <ul>
 *   <li>{@code r = ...} writes stage {@code r}</li>
 *   <li>{@code r[3] = ...} writes stage {@code r[3]}; a non-constant index writes {@code r}</li>
 *   <li>{@code r = {a, b, c}} with a matching constant width writes one stage per bit</li>
 * </ul>
 * Anything else on the left-hand side (nets, part selects, concatenations)
 * is ignored.
 */
public class DesignGraphBuilder {
    private static final Logger log = LoggerFactory.getLogger(DesignGraphBuilder.class);

    private final ConstantEvaluator evaluator;
    private final FunctionalClockResolver clockResolver;
    private final IdentifierCollector identifierCollector;

    public DesignGraphBuilder() {
        this(new ConstantEvaluator(), new FunctionalClockResolver());
    }

    public DesignGraphBuilder(ConstantEvaluator evaluator, FunctionalClockResolver clockResolver) {
        this.evaluator = Objects.requireNonNull(evaluator, "evaluator");
        this.clockResolver = Objects.requireNonNull(clockResolver, "clockResolver");
        this.identifierCollector = new IdentifierCollector(evaluator);
    }

    public DesignGraph build(SourceNode source) {
        return build(source, new ToolDiagnostics());
    }

    public DesignGraph build(SourceNode source, ToolDiagnostics diagnostics) {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(diagnostics, "diagnostics");

        Map<String, DesignModule> modules = new LinkedHashMap<>();
        new Walker(modules, diagnostics).scan(source, BuildContext.root());

        DesignGraph graph = new DesignGraph(modules);
        log.info("Built design graph: {} modules, {} registers",
                graph.getModules().size(), graph.getAllRegisters().size());
        return graph;
    }

    private final class Walker extends SyntaxTreeScanner<BuildContext> {
        private final Map<String, DesignModule> modules;
        private final ToolDiagnostics diagnostics;

        private Walker(Map<String, DesignModule> modules, ToolDiagnostics diagnostics) {
            this.modules = modules;
            this.diagnostics = diagnostics;
        }

        @Override
        public void visit(ModuleDefNode moduleDef, BuildContext context) {
            DesignModule module = new DesignModule(moduleDef.getName(), moduleDef.getSourceFile());
            scanChildren(moduleDef, context.withModule(module));

            DesignModule previous = modules.remove(module.getName());
            if (previous != null) {
                diagnostics.getWarnings().add(moduleDef.getSourceFile() + ":" + moduleDef.getLine()
                        + ": module " + module.getName() + " redefined, replacing the definition from "
                        + previous.getSourceFile());
            }
            modules.put(module.getName(), module);
        }

        @Override
        public void visit(PortNode port, BuildContext context) {
            context.getModule().addPort(port.getName());
        }

        @Override
        public void visit(PortDeclNode portDecl, BuildContext context) {
            context.getModule().addPort(portDecl.getName());
        }

        @Override
        public void visit(RegDeclNode regDecl, BuildContext context) {
            DesignModule module = context.getModule();
            if (module.findRegister(regDecl.getName()).isPresent()) {
                log.debug("Register {}.{} declared again at line {}, keeping the first declaration",
                        module.getName(), regDecl.getName(), regDecl.getLine());
                return;
            }
            module.declareRegister(regDecl.getName(), evaluator.bitIndices(regDecl.getWidth()).orElse(null));
        }

        @Override
        public void visit(NetDeclNode netDecl, BuildContext context) {
            context.getModule().declareNet(netDecl.getName(), netDecl.getKind());
        }

        @Override
        public void visit(AlwaysNode always, BuildContext context) {
            String clock = clockResolver.resolve(always.getSensList()).orElse(null);
            log.debug("Always block at {}:{} clocked by {}", context.getModule().getName(), always.getLine(),
                    clock != null ? clock : "nothing");
            scan(always.getStatement(), context.withClock(clock));
        }

        @Override
        public void visit(AssignmentNode assignment, BuildContext context) {
            DesignModule module = context.getModule();
            if (module == null) {
                return;
            }
            for (StageWrite write : resolveWrites(module, assignment)) {
                Register register = write.register;
                if (register.assignClockIfUnset(context.getClock())) {
                    log.debug("Register {}.{} clocked by {}", module.getName(), register.getName(), context.getClock());
                }
                register.recordDrivers(write.stage, identifierCollector.collect(write.source));
            }
        }

        private List<StageWrite> resolveWrites(DesignModule module, AssignmentNode assignment) {
            SyntaxNode left = assignment.getLeft();
            SyntaxNode right = assignment.getRight();

            if (left instanceof IdentifierNode identifier) {
                return module.findRegister(identifier.getName())
                        .map(register -> splitVectorWrite(register, right))
                        .orElse(List.of());
            }

            if (left instanceof IndexNode index && index.getTarget() instanceof IdentifierNode target) {
                Optional<Register> found = module.findRegister(target.getName());
                if (found.isEmpty()) {
                    return List.of();
                }
                Register register = found.get();
                String stage = evaluator.evaluate(index.getIndex()).stream()
                        .filter(register::hasBit)
                        .mapToObj(register::stageKey)
                        .findFirst()
                        .orElse(register.getName());
                return List.of(new StageWrite(register, stage, right));
            }

            log.debug("Ignoring assignment target at {}:{}", module.getName(), assignment.getLine());
            return List.of();
        }

        private List<StageWrite> splitVectorWrite(Register register, SyntaxNode right) {
            List<Integer> bits = register.getBitIndices().orElse(List.of());
            if (!bits.isEmpty() && right instanceof ConcatNode concat) {
                List<SyntaxNode> elements = concat.flatten();
                if (elements.size() == bits.size()) {
                    List<StageWrite> writes = new ArrayList<>(bits.size());
                    for (int i = 0; i < bits.size(); i++) {
                        writes.add(new StageWrite(register, register.stageKey(bits.get(i)), elements.get(i)));
                    }
                    return writes;
                }
            }
            return List.of(new StageWrite(register, register.getName(), right));
        }
    }

    private static final class StageWrite {
        private final Register register;
        private final String stage;
        private final SyntaxNode source;

        private StageWrite(Register register, String stage, SyntaxNode source) {
            this.register = register;
            this.stage = stage;
            this.source = source;
        }
    }
}
