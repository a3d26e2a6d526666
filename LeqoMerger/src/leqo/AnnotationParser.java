package leqo;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedSet;

// Aliases resolve back to the local qubit ids they denote, so annotating an alias annotates the
// underlying qubits.
public final class AnnotationParser extends StatementTransformer {
  private static final Logger LOG = LoggerFactory.getLogger(AnnotationParser.class);

  private final ProgramNode node;

  private int nextId = 0;
  private boolean inUncompute = false;

  private final Map<String, ImmutableList<Integer>> declarationToIds = new LinkedHashMap<>();
  private final Map<String, ImmutableList<Integer>> aliasToIds = new HashMap<>();
  private final Map<String, ClassicalType> classicalTypes = new HashMap<>();
  private final Map<Integer, QubitAnnotation.Builder> idToInfo = new LinkedHashMap<>();
  private final TreeMap<Integer, IOInstance> inputs = new TreeMap<>();
  private final TreeMap<Integer, IOInstance> outputs = new TreeMap<>();

  private AnnotationParser(ProgramNode node) {
    this.node = node;
  }

  public static AnnotationModel parse(ProgramNode node, Program program)
      throws CompilerException {
    AnnotationParser parser = new AnnotationParser(node);
    try {
      parser.transformAll(program.statements());
      checkContiguous(parser.inputs, "input");
      checkContiguous(parser.outputs, "output");
    } catch (CompilerException ex) {
      throw ex.attributeTo(node);
    }

    AnnotationModel model = parser.build();
    LOG.debug(
        "{}: {} qubits, {} inputs, {} outputs",
        node,
        model.qubitCount(),
        model.inputs().size(),
        model.outputs().size());
    return model;
  }

  private AnnotationModel build() {
    AnnotationModel.Builder builder = AnnotationModel.builder();
    builder.declarationToIdsBuilder().putAll(declarationToIds);
    idToInfo.forEach((id, info) -> builder.idToInfoBuilder().put(id, info.build()));
    builder.inputsBuilder().putAll(inputs);
    builder.outputsBuilder().putAll(outputs);
    return builder.build();
  }

  private static void checkContiguous(TreeMap<Integer, IOInstance> indices, String kind)
      throws CompilerException {
    int expected = 0;
    for (int index : indices.keySet()) {
      if (index != expected) {
        throw new CompilerException(
            String.format("missing %s index %d, next index was %d", kind, expected, index));
      }
      expected++;
    }
  }

  // Annotations over a declaration: at most one input or dirty, never both.
  private static final class DeclarationAnnotations {
    Optional<Annotation> input = Optional.empty();
    Optional<Annotation> dirty = Optional.empty();
  }

  private static final class AliasAnnotations {
    Optional<Annotation> output = Optional.empty();
    Optional<Annotation> reusable = Optional.empty();
  }

  private DeclarationAnnotations declarationAnnotations(String name, Statement statement)
      throws CompilerException {
    DeclarationAnnotations result = new DeclarationAnnotations();
    for (Annotation annotation : statement.annotations()) {
      switch (annotation.keyword()) {
        case Annotation.INPUT:
          if (result.input.isPresent()) {
            throw new CompilerException(node, "two input annotations over " + name);
          }
          result.input = Optional.of(annotation);
          break;
        case Annotation.DIRTY:
          if (result.dirty.isPresent()) {
            throw new CompilerException(node, "two dirty annotations over " + name);
          }
          result.dirty = Optional.of(annotation);
          break;
        case Annotation.OUTPUT:
        case Annotation.REUSABLE:
          throw new CompilerException(
              node,
              String.format(
                  "@%s is only valid over an alias, found over %s", annotation.keyword(), name));
        case Annotation.UNCOMPUTE:
          throw misplacedUncompute(name);
        default:
          break;
      }
    }
    if (result.input.isPresent() && result.dirty.isPresent()) {
      throw new CompilerException(node, "input and dirty annotations over " + name);
    }
    if (inUncompute && result.input.isPresent()) {
      throw new CompilerException(node, "input declaration " + name + " inside uncompute block");
    }
    return result;
  }

  private AliasAnnotations aliasAnnotations(String name, Statement statement)
      throws CompilerException {
    AliasAnnotations result = new AliasAnnotations();
    for (Annotation annotation : statement.annotations()) {
      switch (annotation.keyword()) {
        case Annotation.OUTPUT:
          if (result.output.isPresent()) {
            throw new CompilerException(node, "two output annotations over " + name);
          }
          result.output = Optional.of(annotation);
          break;
        case Annotation.REUSABLE:
          if (result.reusable.isPresent()) {
            throw new CompilerException(node, "two reusable annotations over " + name);
          }
          result.reusable = Optional.of(annotation);
          break;
        case Annotation.INPUT:
        case Annotation.DIRTY:
          throw new CompilerException(
              node,
              String.format(
                  "@%s is only valid over a declaration, found over alias %s",
                  annotation.keyword(), name));
        case Annotation.UNCOMPUTE:
          throw misplacedUncompute("alias " + name);
        default:
          break;
      }
    }
    if (result.output.isPresent() && result.reusable.isPresent()) {
      throw new CompilerException(node, "output and reusable annotations over " + name);
    }
    if (inUncompute && result.output.isPresent()) {
      throw new CompilerException(node, "output alias " + name + " inside uncompute block");
    }
    return result;
  }

  private CompilerException misplacedUncompute(String target) {
    return new CompilerException(
        node,
        String.format(
            "@%s is only valid over an if block, found over %s", Annotation.UNCOMPUTE, target));
  }

  private void registerInput(int index, IOInstance instance) throws CompilerException {
    if (inputs.containsKey(index)) {
      throw new CompilerException(node, "duplicate input index " + index);
    }
    inputs.put(index, instance);
  }

  private void registerOutput(int index, IOInstance instance) throws CompilerException {
    if (outputs.containsKey(index)) {
      throw new CompilerException(node, "duplicate output index " + index);
    }
    outputs.put(index, instance);
  }

  private void checkUnusedName(String name) throws CompilerException {
    if (declarationToIds.containsKey(name)
        || aliasToIds.containsKey(name)
        || classicalTypes.containsKey(name)) {
      throw new CompilerException(node, "redefinition of " + name);
    }
  }

  @Override
  protected Edit visitQubitDeclaration(Statement.QubitDeclaration declaration)
      throws CompilerException {
    String name = declaration.name();
    DeclarationAnnotations annotations = declarationAnnotations(name, declaration);
    checkUnusedName(name);

    int size =
        declaration.size().isPresent() ? ASTNodeUtils.exprToInt(declaration.size().get()) : 1;
    if (size <= 0) {
      throw new CompilerException(node, String.format("invalid size %d of %s", size, name));
    }

    Optional<Integer> inputIndex = Optional.empty();
    if (annotations.input.isPresent()) {
      inputIndex = Optional.of(ASTNodeUtils.parseIoIndex(annotations.input.get()));
    }
    ImmutableSortedSet<Integer> dirtyPositions =
        annotations.dirty.isPresent()
            ? ASTNodeUtils.parsePositions(annotations.dirty.get(), size)
            : ImmutableSortedSet.of();

    ImmutableList.Builder<Integer> ids = ImmutableList.builder();
    for (int position = 0; position < size; position++) {
      int id = nextId++;
      QubitAnnotation.Builder info = QubitAnnotation.builder();
      if (inputIndex.isPresent()) {
        info.setInput(QubitAnnotation.IOPosition.create(inputIndex.get(), position));
      }
      info.setDirty(dirtyPositions.contains(position));
      idToInfo.put(id, info);
      ids.add(id);
    }
    ImmutableList<Integer> declared = ids.build();
    declarationToIds.put(name, declared);

    if (inputIndex.isPresent()) {
      registerInput(inputIndex.get(), IOInstance.QubitIOInstance.create(name, declared));
    }
    return Edit.keep();
  }

  @Override
  protected Edit visitClassicalDeclaration(Statement.ClassicalDeclaration declaration)
      throws CompilerException {
    String name = declaration.name();
    DeclarationAnnotations annotations = declarationAnnotations(name, declaration);
    if (annotations.dirty.isPresent()) {
      throw new CompilerException(node, "dirty annotation over classical declaration " + name);
    }
    checkUnusedName(name);

    ClassicalType type = declaration.classicalType();
    classicalTypes.put(name, type);
    if (annotations.input.isPresent()) {
      int index = ASTNodeUtils.parseIoIndex(annotations.input.get());
      registerInput(index, IOInstance.ClassicalIOInstance.create(name, type));
    }
    return Edit.keep();
  }

  @Override
  protected Edit visitAlias(Statement.AliasStatement alias) throws CompilerException {
    String name = alias.name();
    AliasAnnotations annotations = aliasAnnotations(name, alias);
    checkUnusedName(name);

    Optional<String> source = ASTNodeUtils.someIdentifier(alias.value());
    if (!source.isPresent()) {
      throw new CompilerException(
          node, String.format("unsupported expression '%s' in alias %s", alias.value(), name));
    }
    if (classicalTypes.containsKey(source.get())) {
      handleClassicalAlias(alias, annotations);
    } else if (isQubitName(source.get())) {
      handleQubitAlias(alias, annotations);
    } else {
      throw new CompilerException(
          node, String.format("alias %s references unknown identifier %s", name, source.get()));
    }
    return Edit.keep();
  }

  private boolean isQubitName(String name) {
    return declarationToIds.containsKey(name) || aliasToIds.containsKey(name);
  }

  private void handleQubitAlias(Statement.AliasStatement alias, AliasAnnotations annotations)
      throws CompilerException {
    String name = alias.name();
    ImmutableList<Integer> ids = resolveQubits(alias.value());
    if (ids.isEmpty()) {
      throw new CompilerException(node, "unable to resolve qubits of alias " + name);
    }
    aliasToIds.put(name, ids);

    if (annotations.reusable.isPresent()) {
      for (int position : ASTNodeUtils.parsePositions(annotations.reusable.get(), ids.size())) {
        int id = ids.get(position);
        QubitAnnotation.Builder info = idToInfo.get(id);
        QubitAnnotation current = info.build();
        if (current.output().isPresent()) {
          throw new CompilerException(
              node, String.format("alias %s declares output qubit as reusable", name));
        }
        if (current.reusable() || current.uncomputable()) {
          throw new CompilerException(
              node, String.format("qubit %d of alias %s declared reusable twice", position, name));
        }
        if (inUncompute) {
          info.setUncomputable(true);
        } else {
          info.setReusable(true);
        }
      }
    }

    if (annotations.output.isPresent()) {
      int index = ASTNodeUtils.parseIoIndex(annotations.output.get());
      for (int position = 0; position < ids.size(); position++) {
        QubitAnnotation.Builder info = idToInfo.get(ids.get(position));
        QubitAnnotation current = info.build();
        if (current.output().isPresent()) {
          throw new CompilerException(
              node, String.format("alias %s tries to overwrite already declared output", name));
        }
        if (current.reusable() || current.uncomputable()) {
          throw new CompilerException(
              node, String.format("alias %s declares output for reusable qubit", name));
        }
        info.setOutput(QubitAnnotation.IOPosition.create(index, position));
      }
      registerOutput(index, IOInstance.QubitIOInstance.create(name, ids));
    }
  }

  private ImmutableList<Integer> resolveQubits(Expression value) throws CompilerException {
    switch (value.type()) {
      case IDENTIFIER:
        return qubitsOf(value.<Expression.Identifier>cast().name());
      case INDEX:
        {
          Expression.IndexExpression index = value.cast();
          if (index.collection().type() != Expression.Type.IDENTIFIER) {
            throw new CompilerException(
                node, String.format("unsupported indexed expression '%s' in alias", value));
          }
          ImmutableList<Integer> source =
              qubitsOf(index.collection().<Expression.Identifier>cast().name());
          List<Integer> selected = new ArrayList<>();
          for (int position : ASTNodeUtils.resolveIndices(index.indices(), source.size())) {
            selected.add(source.get(position));
          }
          return ImmutableList.copyOf(selected);
        }
      case CONCATENATION:
        {
          Expression.Concatenation concat = value.cast();
          return ImmutableList.<Integer>builder()
              .addAll(resolveQubits(concat.lhs()))
              .addAll(resolveQubits(concat.rhs()))
              .build();
        }
      default:
        throw new CompilerException(
            node, String.format("unsupported expression '%s' in alias", value));
    }
  }

  private ImmutableList<Integer> qubitsOf(String name) throws CompilerException {
    ImmutableList<Integer> ids = declarationToIds.get(name);
    if (ids == null) ids = aliasToIds.get(name);
    if (ids == null) {
      String reason = classicalTypes.containsKey(name) ? "a classical value" : "unknown";
      throw new CompilerException(
          node, String.format("identifier %s in qubit alias is %s", name, reason));
    }
    return ids;
  }

  private void handleClassicalAlias(Statement.AliasStatement alias, AliasAnnotations annotations)
      throws CompilerException {
    String name = alias.name();
    if (annotations.reusable.isPresent()) {
      throw new CompilerException(node, "reusable annotation over classical alias " + name);
    }

    ClassicalType type = resolveClassical(alias.value());
    classicalTypes.put(name, type);
    if (annotations.output.isPresent()) {
      int index = ASTNodeUtils.parseIoIndex(annotations.output.get());
      registerOutput(index, IOInstance.ClassicalIOInstance.create(name, type));
    }
  }

  // Bits can be indexed and concatenated like qubits; other classical values can only be renamed.
  private ClassicalType resolveClassical(Expression value) throws CompilerException {
    switch (value.type()) {
      case IDENTIFIER:
        {
          String name = value.<Expression.Identifier>cast().name();
          ClassicalType type = classicalTypes.get(name);
          if (type == null) {
            throw new CompilerException(
                node, String.format("identifier %s in classical alias is not classical", name));
          }
          return type;
        }
      case INDEX:
        {
          Expression.IndexExpression index = value.cast();
          ClassicalType source = requireBits(resolveClassical(index.collection()), value);
          int width = ASTNodeUtils.resolveIndices(index.indices(), source.size()).size();
          return ClassicalType.bit(width);
        }
      case CONCATENATION:
        {
          Expression.Concatenation concat = value.cast();
          ClassicalType lhs = requireBits(resolveClassical(concat.lhs()), value);
          ClassicalType rhs = requireBits(resolveClassical(concat.rhs()), value);
          return ClassicalType.bit(lhs.size() + rhs.size());
        }
      default:
        throw new CompilerException(
            node, String.format("unsupported expression '%s' in alias", value));
    }
  }

  private ClassicalType requireBits(ClassicalType type, Expression value)
      throws CompilerException {
    if (type.kind() != ClassicalType.Kind.BIT) {
      throw new CompilerException(
          node, String.format("can't index or concatenate %s in '%s'", type, value));
    }
    return type;
  }

  @Override
  protected Edit visitBranching(Statement.BranchingStatement branch) throws CompilerException {
    if (!branch.isUncomputeBlock()) return visitChildren(branch);

    if (inUncompute) throw new CompilerException(node, "nested uncompute blocks");
    if (branch.hasElseBlock()) {
      throw new CompilerException(node, "uncompute block with else branch");
    }
    inUncompute = true;
    try {
      return visitChildren(branch);
    } finally {
      inUncompute = false;
    }
  }

  @Override
  protected Edit visitOther(Statement statement) throws CompilerException {
    if (statement.hasAnnotation(Annotation.UNCOMPUTE)) {
      Statement bare = statement.withAnnotations(ImmutableList.of());
      throw misplacedUncompute(QasmPrinter.printStatement(bare));
    }
    return Edit.keep();
  }
}
