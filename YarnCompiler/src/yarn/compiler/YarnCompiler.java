package yarn.compiler;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.ImmutableSortedSet;

import yarn.core.Library;
import yarn.core.Node;
import yarn.core.Program;
import yarn.core.Value;
import yarn.core.ValueType;

/**
 * Compiles scripts into a {@link Program}.
 *
 * <p>Compilation runs seven passes in order, each extending what the ones before it found:
 *
 * <ol>
 *   <li>parse every file and build the string table
 *   <li>collect {@code <<declare>>}d variables
 *   <li>type check, declaring variables first used without a declaration
 *   <li>find the nodes whose visits are counted
 *   <li>declare a visit counter for each of them
 *   <li>generate code, unless an error was found
 *   <li>give every variable its initial value
 * </ol>
 *
 * Script errors never throw: they are returned as diagnostics, and an error means no program.
 */
public final class YarnCompiler {
  private static final Logger log = LoggerFactory.getLogger(YarnCompiler.class);

  private final CompilerSettings settings;

  public YarnCompiler() {
    this(CompilerSettings.load());
  }

  public YarnCompiler(CompilerSettings settings) {
    this.settings = settings;
  }

  public CompilerSettings settings() {
    return settings;
  }

  public CompilationResult compile(CompilationJob job) {
    CompilationType type = job.compilationType().orElse(settings.compilationType());
    CompilationIntermediate intermediate = new CompilationIntermediate(job, settings);
    log.debug("Compiling {} file(s), {}", job.files().size(), type);

    registerStrings(intermediate);
    if (type == CompilationType.STRINGS_ONLY) return result(intermediate);

    getDeclarations(intermediate);
    checkTypes(intermediate);
    if (type == CompilationType.TYPE_CHECK) return result(intermediate);

    findTrackingNodes(intermediate);
    addTrackingDeclarations(intermediate);
    generateCode(intermediate);
    addInitialValueRegistrations(intermediate);
    return result(intermediate);
  }

  public CompilationResult compileString(String fileName, String source) {
    return compile(CompilationJob.fromString(fileName, source));
  }

  private static void registerStrings(CompilationIntermediate intermediate) {
    for (SourceFile source : intermediate.job.files()) {
      Parser parser = new Parser(source.fileName(), source.source());
      YarnFile file = parser.parse();
      parser.errors().forEach(ex -> intermediate.diagnostics.add(ex.toDiagnostic()));

      file.accept(new LastLineBeforeOptionsTagger(), null);

      StringTableGenerator generator =
          new StringTableGenerator(
              source.fileName(),
              intermediate.settings.implicitLineIdPrefix(),
              intermediate.stringTable,
              intermediate.lineIds);
      file.accept(generator, null);
      intermediate.diagnostics.addAll(generator.diagnostics());

      intermediate.parsedFiles.add(file);
    }
    log.debug("Registered {} string(s)", intermediate.stringTable.size());
  }

  private static void getDeclarations(CompilationIntermediate intermediate) {
    Library library = intermediate.job.library().orElseGet(Library::standardLibrary);
    library
        .functions()
        .forEach(
            (name, function) ->
                intermediate.addDeclaration(
                    Declaration.builder(
                            name, YarnType.function(function), Declaration.Provenance.EXTERNAL)
                        .build()));

    // The dialogue supplies these, closed over its variable storage.
    if (!library.contains(Library.VISITED)) {
      intermediate.addDeclaration(
          Declaration.builder(
                  Library.VISITED,
                  YarnType.function(ValueType.BOOLEAN, ImmutableList.of(ValueType.STRING)),
                  Declaration.Provenance.EXTERNAL)
              .build());
    }
    if (!library.contains(Library.VISITED_COUNT)) {
      intermediate.addDeclaration(
          Declaration.builder(
                  Library.VISITED_COUNT,
                  YarnType.function(ValueType.NUMBER, ImmutableList.of(ValueType.STRING)),
                  Declaration.Provenance.EXTERNAL)
              .build());
    }

    for (Declaration declaration : intermediate.job.declarations()) {
      intermediate.addDeclaration(
          declaration.toBuilder().setProvenance(Declaration.Provenance.EXTERNAL).build());
    }

    for (YarnFile file : intermediate.parsedFiles) {
      DeclarationCollector collector = new DeclarationCollector(file.fileName(), intermediate);
      file.accept(collector, null);
      intermediate.diagnostics.addAll(collector.diagnostics());
      intermediate.fileTags.put(file.fileName(), file.fileTags());
    }
    log.debug("Collected {} declaration(s)", intermediate.derivedDeclarations.size());
  }

  private static void checkTypes(CompilationIntermediate intermediate) {
    Set<String> nodeNames =
        intermediate
            .parsedFiles
            .stream()
            .flatMap(file -> file.nodes().stream())
            .map(NodeDefinition::title)
            .collect(ImmutableSet.toImmutableSet());

    List<YarnFile> deferred = new ArrayList<>();
    for (YarnFile file : intermediate.parsedFiles) {
      TypeCheckVisitor checker =
          new TypeCheckVisitor(file.fileName(), intermediate, nodeNames, false);
      file.accept(checker, null);
      if (checker.deferred()) {
        deferred.add(file);
      } else {
        intermediate.diagnostics.addAll(checker.diagnostics());
      }
    }

    // Other files may since have settled what the deferred uses are.
    for (YarnFile file : deferred) {
      log.debug("Checking {} again", file.fileName());
      TypeCheckVisitor checker =
          new TypeCheckVisitor(file.fileName(), intermediate, nodeNames, true);
      file.accept(checker, null);
      intermediate.diagnostics.addAll(checker.diagnostics());
    }
  }

  private static void findTrackingNodes(CompilationIntermediate intermediate) {
    NodeTrackingVisitor visitor =
        new NodeTrackingVisitor(intermediate.trackingNodes, intermediate.ignoringTrackingNodes);
    intermediate.parsedFiles.forEach(file -> file.accept(visitor, null));
    intermediate.trackingNodes.removeAll(intermediate.ignoringTrackingNodes);
    log.debug("Tracking visits of {}", intermediate.trackingNodes);
  }

  private static void addTrackingDeclarations(CompilationIntermediate intermediate) {
    for (String node : intermediate.trackingNodes) {
      String name = Library.generateUniqueVisitedVariableForNode(node);
      if (intermediate.knownDeclarations.containsKey(name)) continue;

      intermediate.addDeclaration(
          Declaration.builder(name, YarnType.of(ValueType.NUMBER), Declaration.Provenance.DERIVED)
              .setDefaultValue(Value.of(0))
              .setDescription(String.format("The number of times '%s' was completed", node))
              .setSourceNode(node)
              .build());
    }
  }

  private static void generateCode(CompilationIntermediate intermediate) {
    if (intermediate.hasErrors()) {
      log.debug("Not generating code: errors found");
      return;
    }

    Program.Builder program = Program.builder();
    Map<String, Tokenizer.Pos> nodePositions = new HashMap<>();
    boolean conflict = false;
    for (YarnFile file : intermediate.parsedFiles) {
      FileCompilation compilation =
          new CodeGenerator(
                  file,
                  intermediate.expressionTypes,
                  intermediate.lineIds,
                  intermediate.trackingNodes)
              .compile();
      intermediate.diagnostics.addAll(compilation.diagnostics());
      conflict |= !compilation.diagnostics().isEmpty();

      for (Node node : compilation.nodes()) {
        Tokenizer.Pos pos = compilation.nodePositions().get(node.name());
        if (program.hasNode(node.name())) {
          intermediate.diagnostics.add(
              Diagnostic.error(
                  pos,
                  String.format(
                      "duplicate node '%s', first defined at %s",
                      node.name(), nodePositions.get(node.name()))));
          conflict = true;
          continue;
        }
        program.addNode(node);
        nodePositions.put(node.name(), pos);
      }
      intermediate.debugInfos.putAll(compilation.debugInfos());
    }

    if (!conflict) {
      intermediate.program = Optional.of(program.build());
      log.debug("Generated {} node(s)", nodePositions.size());
    }
  }

  private static void addInitialValueRegistrations(CompilationIntermediate intermediate) {
    Program.Builder program = Program.builder();
    intermediate.program.ifPresent(program::addProgram);

    for (Declaration declaration : intermediate.knownDeclarations.values()) {
      if (!declaration.isVariable()) continue;
      if (!declaration.defaultValue().isPresent()) {
        intermediate.diagnostics.add(
            Diagnostic.error(
                declaration.pos().orElse(Tokenizer.Pos.internal()),
                String.format("'%s' has no default value", declaration.name())));
        continue;
      }
      program.setInitialValue(declaration.name(), declaration.defaultValue().get());
    }

    if (intermediate.program.isPresent()) {
      intermediate.program = Optional.of(program.build());
    }
  }

  private static CompilationResult result(CompilationIntermediate intermediate) {
    return CompilationResult.builder()
        .setProgram(intermediate.program)
        .setDiagnostics(ImmutableSortedSet.copyOf(intermediate.diagnostics))
        .setStringTable(ImmutableMap.copyOf(intermediate.stringTable))
        .setDeclarations(intermediate.derivedDeclarations.values())
        .setDebugInfos(ImmutableMap.copyOf(intermediate.debugInfos))
        .setFileTags(ImmutableMap.copyOf(intermediate.fileTags))
        .setContainsImplicitStringTags(intermediate.containsImplicitStringTags())
        .build();
  }
}
