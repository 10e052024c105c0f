package org.fluxgen.cli.document;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import org.fluxgen.compiler.api.ResolverException;
import org.fluxgen.compiler.graph.BlockId;
import org.fluxgen.compiler.graph.Connection;
import org.fluxgen.compiler.graph.Graph;
import org.fluxgen.compiler.graph.Node;
import org.fluxgen.compiler.graph.NodeKind;
import org.fluxgen.compiler.graph.PortId;
import org.fluxgen.compiler.graph.nodes.AppendNode;
import org.fluxgen.compiler.graph.nodes.BasicLiteralNode;
import org.fluxgen.compiler.graph.nodes.BranchNode;
import org.fluxgen.compiler.graph.nodes.CallNode;
import org.fluxgen.compiler.graph.nodes.CompositeLiteralNode;
import org.fluxgen.compiler.graph.nodes.ConvertNode;
import org.fluxgen.compiler.graph.nodes.DeleteNode;
import org.fluxgen.compiler.graph.nodes.FuncNode;
import org.fluxgen.compiler.graph.nodes.IfNode;
import org.fluxgen.compiler.graph.nodes.IndexNode;
import org.fluxgen.compiler.graph.nodes.LenNode;
import org.fluxgen.compiler.graph.nodes.LoopNode;
import org.fluxgen.compiler.graph.nodes.MakeNode;
import org.fluxgen.compiler.graph.nodes.OperatorNode;
import org.fluxgen.compiler.graph.nodes.TypeAssertNode;
import org.fluxgen.compiler.graph.nodes.ValueNode;
import org.fluxgen.compiler.semantics.ConstSymbol;
import org.fluxgen.compiler.semantics.FieldSymbol;
import org.fluxgen.compiler.semantics.FuncSymbol;
import org.fluxgen.compiler.semantics.LocalVar;
import org.fluxgen.compiler.semantics.PackageScope;
import org.fluxgen.compiler.semantics.Symbol;
import org.fluxgen.compiler.semantics.TypeNameSymbol;
import org.fluxgen.compiler.semantics.VarSymbol;
import org.fluxgen.compiler.types.GoPackage;
import org.fluxgen.compiler.types.NamedType;
import org.fluxgen.compiler.types.SignatureType;
import org.fluxgen.compiler.types.StructuralTypeResolver;
import org.fluxgen.compiler.types.Type;
import org.fluxgen.compiler.types.Var;
import org.fluxgen.compiler.types.WildcardType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Builds a {@link Graph} from a {@link GraphDocument}.
 * <p>
 * All nodes are created through the graph's structural edits, so the resulting graph
 * carries the same derived types as one built interactively. Connections are applied in
 * document order; ports that appear only after a type is known, such as a loop's value
 * binding, can be referenced once the connection that determines that type came first.
 * Malformed documents are rejected with an {@link IllegalArgumentException}.
 */
public class GraphDocumentLoader {

    private static final Logger LOG = LoggerFactory.getLogger(GraphDocumentLoader.class);
    private static final Pattern ENDPOINT = Pattern.compile("([^.\\s]+)\\.([a-z]+)(?:\\[(\\d+)])?");

    private final int maxPassesPerNode;
    private final Gson gson = new Gson();

    /**
     * @param maxPassesPerNode Propagation limit of the created graph.
     */
    public GraphDocumentLoader(int maxPassesPerNode) {
        this.maxPassesPerNode = maxPassesPerNode;
    }

    /**
     * Reads and builds a graph document.
     *
     * @param file The JSON file.
     * @return The graph.
     * @throws IOException       if the file cannot be read.
     * @throws ResolverException if a type expression is malformed.
     */
    public Graph load(Path file) throws IOException, ResolverException {
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            GraphDocument doc;
            try {
                doc = gson.fromJson(reader, GraphDocument.class);
            } catch (JsonParseException e) {
                throw new IllegalArgumentException("Malformed graph document " + file + ": " + e.getMessage(), e);
            }
            if (doc == null) {
                throw new IllegalArgumentException("Empty graph document " + file);
            }
            LOG.debug("Loaded graph document {}", file);
            return build(doc);
        }
    }

    /**
     * @param json The document text.
     * @return The graph.
     * @throws ResolverException if a type expression is malformed.
     */
    public Graph parse(String json) throws ResolverException {
        GraphDocument doc;
        try {
            doc = gson.fromJson(json, GraphDocument.class);
        } catch (JsonParseException e) {
            throw new IllegalArgumentException("Malformed graph document: " + e.getMessage(), e);
        }
        if (doc == null) {
            throw new IllegalArgumentException("Empty graph document");
        }
        return build(doc);
    }

    /**
     * Builds the graph of a parsed document.
     */
    public Graph build(GraphDocument doc) throws ResolverException {
        return new Builder(doc).build();
    }

    private static <T> List<T> list(List<T> l) {
        return l == null ? List.of() : l;
    }

    private final class Builder {

        private final GraphDocument doc;
        private final GoPackage pkg;
        private final StructuralTypeResolver resolver;
        private final PackageScope scope;
        private final Map<String, GoPackage> packages = new HashMap<>();
        private final Map<String, Symbol> foreign = new HashMap<>();
        private final Map<String, Node> nodes = new LinkedHashMap<>();
        private final Deque<Map<String, LocalVar>> locals = new ArrayDeque<>();
        private Graph graph;

        Builder(GraphDocument doc) {
            if (doc.pkg() == null || doc.pkg().path() == null || doc.pkg().name() == null) {
                throw new IllegalArgumentException("Graph document has no package");
            }
            this.doc = doc;
            this.pkg = new GoPackage(doc.pkg().path(), doc.pkg().name());
            this.resolver = new StructuralTypeResolver(pkg);
            this.scope = new PackageScope(pkg);
        }

        Graph build() throws ResolverException {
            for (GraphDocument.PackageRef ref : list(doc.imports())) {
                GoPackage p = new GoPackage(ref.path(), ref.name());
                resolver.registerPackage(p);
                packages.put(p.name(), p);
                packages.put(p.path(), p);
            }
            declareTypes();
            graph = new Graph(scope, resolver, maxPassesPerNode);
            declareSymbols();
            List<FuncSymbol> functions = new ArrayList<>();
            for (GraphDocument.FunctionDecl f : list(doc.functions())) {
                FuncSymbol symbol = functionSymbol(f);
                if (symbol.isMethod() || scope.lookup(symbol.name()).isEmpty()) {
                    scope.declare(symbol);
                }
                functions.add(symbol);
            }
            List<GraphDocument.FunctionDecl> decls = list(doc.functions());
            for (int i = 0; i < decls.size(); i++) {
                GraphDocument.FunctionDecl decl = decls.get(i);
                FuncNode f = graph.newFunction(functions.get(i));
                register(decl.id(), f);
                buildFunctionBody(f, decl.body());
            }
            for (GraphDocument.ConnectionDecl c : list(doc.connections())) {
                connect(c);
            }
            LOG.debug("Built graph of package {} with {} nodes", pkg, nodes.size());
            return graph;
        }

        private void declareTypes() throws ResolverException {
            List<NamedType> declared = new ArrayList<>();
            for (GraphDocument.TypeDecl t : list(doc.types())) {
                GoPackage owner = t.pkg() == null ? pkg : packageOf(t.pkg());
                declared.add(resolver.declare(new NamedType(owner, t.name(), WildcardType.INSTANCE)));
            }
            List<GraphDocument.TypeDecl> decls = list(doc.types());
            for (int i = 0; i < decls.size(); i++) {
                NamedType n = declared.get(i);
                n.bindUnderlying(resolver.resolve(decls.get(i).underlying()));
                if (n.pkg().equals(pkg)) {
                    scope.declare(new TypeNameSymbol(n));
                }
            }
        }

        private void declareSymbols() throws ResolverException {
            for (GraphDocument.SymbolDecl s : list(doc.symbols())) {
                GoPackage owner = s.pkg() == null ? pkg : packageOf(s.pkg());
                Symbol symbol = switch (s.kind() == null ? "" : s.kind().toLowerCase(Locale.ROOT)) {
                    case "func" -> new FuncSymbol(owner, s.name(), signature(s.type(), s.receiver()));
                    case "var" -> new VarSymbol(owner, s.name(), resolver.resolve(s.type()));
                    case "const" -> new ConstSymbol(owner, s.name(), resolver.resolve(s.type()));
                    default -> throw new IllegalArgumentException("Unknown symbol kind '" + s.kind() + "' of " + s.name());
                };
                if (owner.equals(pkg)) {
                    scope.declare(symbol);
                } else {
                    foreign.put(owner.name() + "." + symbolKey(symbol), symbol);
                }
            }
        }

        private String symbolKey(Symbol symbol) {
            if (symbol instanceof FuncSymbol f && f.isMethod()) {
                return f.receiverType().map(NamedType::name).orElse("?") + "." + f.name();
            }
            return symbol.name();
        }

        private GoPackage packageOf(String ref) {
            GoPackage p = packages.get(ref);
            if (p == null) {
                throw new IllegalArgumentException("Package '" + ref + "' is not imported");
            }
            return p;
        }

        private FuncSymbol functionSymbol(GraphDocument.FunctionDecl f) throws ResolverException {
            return new FuncSymbol(pkg, f.name(), signature(f.signature(), f.receiver()));
        }

        private SignatureType signature(String text, GraphDocument.VarDecl receiver) throws ResolverException {
            Type t = resolver.resolve(text == null ? "func()" : text);
            if (!(t instanceof SignatureType s)) {
                throw new IllegalArgumentException("Not a function signature: " + text);
            }
            if (receiver == null) {
                return s;
            }
            Var recv = new Var(receiver.name() == null ? "" : receiver.name(), resolver.resolve(receiver.type()));
            return new SignatureType(recv, s.params(), s.results(), s.variadic());
        }

        private void buildFunctionBody(FuncNode f, GraphDocument.BlockDecl body) throws ResolverException {
            Map<String, LocalVar> vars = new HashMap<>();
            SignatureType sig = f.signature();
            if (sig.isMethod()) {
                vars.put(sig.receiver().name(), new LocalVar(sig.receiver().name(), sig.receiver().type()));
            }
            for (Var v : sig.params()) {
                vars.put(v.name(), new LocalVar(v.name(), v.type()));
            }
            for (Var v : sig.results()) {
                vars.put(v.name(), new LocalVar(v.name(), v.type()));
            }
            locals.push(vars);
            buildBlock(f.body(), body);
            locals.pop();
        }

        private void buildBlock(BlockId block, GraphDocument.BlockDecl decl) throws ResolverException {
            Map<String, LocalVar> vars = new HashMap<>();
            locals.push(vars);
            if (decl != null) {
                for (GraphDocument.VarDecl v : list(decl.locals())) {
                    LocalVar local = new LocalVar(v.name(), resolver.resolve(v.type()));
                    graph.declareLocal(block, local);
                    vars.put(v.name(), local);
                }
                for (GraphDocument.NodeDecl n : list(decl.nodes())) {
                    buildNode(block, n);
                }
            }
            locals.pop();
        }

        private void buildNode(BlockId block, GraphDocument.NodeDecl n) throws ResolverException {
            NodeKind kind;
            try {
                kind = NodeKind.valueOf(String.valueOf(n.kind()).toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("Unknown node kind '" + n.kind() + "' of node " + n.id(), e);
            }
            Node node = switch (kind) {
                case CALL -> new CallNode(n.func() == null ? null : function(n.func()), flag(n.ellipsis()));
                case INDEX -> new IndexNode(flag(n.set()));
                case LEN -> new LenNode();
                case MAKE -> new MakeNode(resolver.resolve(n.type()));
                case APPEND -> new AppendNode(n.elements() == null ? 1 : n.elements(), flag(n.ellipsis()));
                case DELETE -> new DeleteNode();
                case OPERATOR -> n.unary() == null ? new OperatorNode(n.operator()) : new OperatorNode(n.operator(), n.unary());
                case BASIC_LITERAL -> new BasicLiteralNode(
                        BasicLiteralNode.Kind.valueOf(String.valueOf(n.literal()).toUpperCase(Locale.ROOT)),
                        n.text() == null ? "" : n.text());
                case COMPOSITE_LITERAL -> new CompositeLiteralNode(resolver.resolve(n.type()),
                        n.elements() == null ? 0 : n.elements());
                case VALUE -> new ValueNode(valueSymbol(n), flag(n.set()));
                case TYPE_ASSERT -> new TypeAssertNode(resolver.resolve(n.type()));
                case CONVERT -> new ConvertNode(resolver.resolve(n.type()));
                case FUNC -> {
                    Type t = resolver.resolve(n.signature());
                    if (!(t instanceof SignatureType s)) {
                        throw new IllegalArgumentException("Function literal " + n.id() + " needs a signature");
                    }
                    yield new FuncNode(s);
                }
                case IF -> new IfNode(Math.max(1, list(n.branches()).size()));
                case LOOP -> new LoopNode();
                case BRANCH -> new BranchNode(n.text());
                case PORTS -> throw new IllegalArgumentException(
                        "Boundary nodes are created with their function or loop: " + n.id());
            };
            graph.addNode(block, node);
            register(n.id(), node);
            if (node instanceof FuncNode f) {
                buildFunctionBody(f, n.body());
            } else if (node instanceof LoopNode l) {
                buildBlock(l.body(), n.body());
            } else if (node instanceof IfNode i) {
                List<GraphDocument.BlockDecl> branches = list(n.branches());
                for (int b = 0; b < branches.size(); b++) {
                    buildBlock(i.branches().get(b), branches.get(b));
                }
            }
        }

        private static boolean flag(Boolean b) {
            return b != null && b;
        }

        private Symbol valueSymbol(GraphDocument.NodeDecl n) throws ResolverException {
            if (n.local() != null) {
                for (Map<String, LocalVar> vars : locals) {
                    LocalVar v = vars.get(n.local());
                    if (v != null) {
                        return v;
                    }
                }
                throw new IllegalArgumentException("Unknown local '" + n.local() + "' in node " + n.id());
            }
            if (n.field() != null) {
                return new FieldSymbol(n.field(), resolver.resolve(n.type()));
            }
            if (n.method() != null) {
                return function(n.method());
            }
            if (n.symbol() != null) {
                return symbol(n.symbol());
            }
            return null;
        }

        private FuncSymbol function(String ref) {
            if (symbol(ref) instanceof FuncSymbol f) {
                return f;
            }
            throw new IllegalArgumentException("'" + ref + "' is not a function");
        }

        private Symbol symbol(String ref) {
            Symbol s = scope.lookup(ref).orElse(foreign.get(ref));
            if (s == null) {
                throw new IllegalArgumentException("Unknown symbol '" + ref + "'");
            }
            return s;
        }

        private void register(String id, Node node) {
            if (id == null) {
                return;
            }
            if (nodes.putIfAbsent(id, node) != null) {
                throw new IllegalArgumentException("Duplicate node id '" + id + "'");
            }
        }

        private void connect(GraphDocument.ConnectionDecl c) {
            PortId from = endpoint(c.from(), true);
            PortId to = endpoint(c.to(), false);
            Connection connection = graph.connect(from, to);
            if (flag(c.hidden())) {
                graph.setHidden(connection.id(), true, c.label() == null ? "" : c.label());
            }
        }

        private PortId endpoint(String ref, boolean output) {
            Matcher m = ENDPOINT.matcher(ref == null ? "" : ref);
            if (!m.matches()) {
                throw new IllegalArgumentException("Malformed endpoint '" + ref + "'");
            }
            Node node = nodes.get(m.group(1));
            if (node == null) {
                throw new IllegalArgumentException("Unknown node '" + m.group(1) + "' in endpoint '" + ref + "'");
            }
            int index = m.group(3) == null ? 0 : Integer.parseInt(m.group(3));
            PortId port;
            try {
                port = switch (m.group(2)) {
                    case "out" -> node.outputs().get(index);
                    case "in" -> node.inputs().get(index);
                    case "seq" -> output ? node.sequenceOut() : node.sequenceIn();
                    case "param" -> ((FuncNode) node).parameterPorts().get(index);
                    case "result" -> ((FuncNode) node).resultPorts().get(index);
                    case "cond" -> ((IfNode) node).conditions().get(index);
                    case "key" -> ((LoopNode) node).keyBinding();
                    case "value" -> ((LoopNode) node).valueBinding();
                    default -> throw new IllegalArgumentException("Unknown port selector in '" + ref + "'");
                };
            } catch (IndexOutOfBoundsException | ClassCastException e) {
                throw new IllegalArgumentException("No such port '" + ref + "'", e);
            }
            if (port == null) {
                throw new IllegalArgumentException("Port '" + ref + "' does not exist for the current types");
            }
            return port;
        }
    }
}
