package org.pragmatica.exfmt.format;

import org.pragmatica.exfmt.ast.Ast;
import org.pragmatica.exfmt.ast.Ast.Apply;
import org.pragmatica.exfmt.ast.Ast.AtomLiteral;
import org.pragmatica.exfmt.ast.Ast.Call;
import org.pragmatica.exfmt.ast.Ast.FloatLiteral;
import org.pragmatica.exfmt.ast.Ast.IntegerLiteral;
import org.pragmatica.exfmt.ast.Ast.ListLiteral;
import org.pragmatica.exfmt.ast.Ast.Pair;
import org.pragmatica.exfmt.ast.Ast.Special;
import org.pragmatica.exfmt.ast.Ast.StringLiteral;
import org.pragmatica.exfmt.ast.Ast.Variable;
import org.pragmatica.exfmt.ast.Asts;
import org.pragmatica.exfmt.ast.Meta;
import org.pragmatica.exfmt.comment.CommentInterleaver;
import org.pragmatica.exfmt.comment.CommentInterleaver.Entry;
import org.pragmatica.exfmt.comment.CommentQueue;
import org.pragmatica.exfmt.comment.GatheredComment;
import org.pragmatica.exfmt.comment.LineRange;
import org.pragmatica.exfmt.config.FormatterConfig;
import org.pragmatica.exfmt.config.LocalWithoutParens;
import org.pragmatica.exfmt.config.Migration;
import org.pragmatica.exfmt.config.SigilMetadata;
import org.pragmatica.exfmt.config.SyntaxColors.Category;
import org.pragmatica.exfmt.doc.Doc;
import org.pragmatica.exfmt.doc.Doc.GroupMode;
import org.pragmatica.exfmt.doc.Doc.Indent;
import org.pragmatica.exfmt.doc.Doc.NestMode;
import org.pragmatica.exfmt.doc.DocRenderer;
import org.pragmatica.exfmt.doc.Docs;
import org.pragmatica.exfmt.error.FormatError;
import org.pragmatica.exfmt.error.FormatException;
import org.pragmatica.exfmt.format.Operators.Associativity;
import org.pragmatica.exfmt.format.Operators.OperatorInfo;
import org.pragmatica.exfmt.literal.AtomNames;
import org.pragmatica.exfmt.literal.NumberLiterals;
import org.pragmatica.exfmt.literal.StringEscapes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.BinaryOperator;
import java.util.function.Function;
import java.util.function.UnaryOperator;

import static org.pragmatica.exfmt.doc.Docs.concat;
import static org.pragmatica.exfmt.doc.Docs.empty;
import static org.pragmatica.exfmt.doc.Docs.flexGlue;
import static org.pragmatica.exfmt.doc.Docs.forceUnfit;
import static org.pragmatica.exfmt.doc.Docs.glue;
import static org.pragmatica.exfmt.doc.Docs.group;
import static org.pragmatica.exfmt.doc.Docs.hardLine;
import static org.pragmatica.exfmt.doc.Docs.isEmpty;
import static org.pragmatica.exfmt.doc.Docs.line;
import static org.pragmatica.exfmt.doc.Docs.nest;
import static org.pragmatica.exfmt.doc.Docs.noLimit;
import static org.pragmatica.exfmt.doc.Docs.softBreak;
import static org.pragmatica.exfmt.doc.Docs.text;
import static org.pragmatica.exfmt.format.Shapes.DOUBLE_HEREDOC;
import static org.pragmatica.exfmt.format.Shapes.SINGLE_HEREDOC;
import static org.pragmatica.exfmt.format.Shapes.closingLine;
import static org.pragmatica.exfmt.format.Shapes.endLine;
import static org.pragmatica.exfmt.format.Shapes.isCall;
import static org.pragmatica.exfmt.format.Shapes.line;

/**
 * Translates a quoted expression into a layout document.
 *
 * <p>One translator serves one formatting call: it owns the queue of comments still to be
 * placed, and every sequence it lays out (block expressions, call arguments, list and map
 * entries, operator chains) takes the comments that fall inside it.
 */
public final class Translator {
    private static final Logger log = LoggerFactory.getLogger(Translator.class);

    private static final String DOUBLE_QUOTE = "\"";
    private static final String SINGLE_QUOTE = "'";
    private static final int DEFAULT_OPERAND_NESTING = 2;

    private final FormatterConfig config;
    private final CommentInterleaver comments;

    private int operandNesting = DEFAULT_OPERAND_NESTING;
    private boolean skipEol;

    private Translator(FormatterConfig config, CommentQueue comments) {
        this.config = config;
        this.comments = new CommentInterleaver(comments);
    }

    /**
     * Translate a whole program: the tree is laid out as a block and every comment is placed.
     */
    public static Doc translate(Ast ast, List<GatheredComment> comments, FormatterConfig config) {
        return new Translator(config, CommentQueue.of(comments)).blockToDoc(ast, LineRange.MIN_LINE, LineRange.MAX_LINE);
    }

    // === Dispatch ===

    Doc toDoc(Ast ast, Context context) {
        if (ast instanceof Special special) {
            return specialToDoc(special);
        }
        if (ast instanceof Variable variable) {
            return color(text(variable.name()), Category.VARIABLE);
        }
        if (ast instanceof Call call) {
            return callToDoc(call, context);
        }
        if (ast instanceof Apply apply) {
            return applyToDoc(apply, context);
        }
        if (ast instanceof ListLiteral list) {
            if (list.elements().isEmpty()) {
                return text("[]");
            }
            return manyArgs(list.elements(), arg -> toDoc(arg, context));
        }
        if (ast instanceof Pair pair) {
            return pairToDoc(pair, context);
        }
        return foreignToDoc(ast);
    }

    private Doc specialToDoc(Special special) {
        var args = special.args();

        return switch (special.kind()) {
            case CLAUSE_ARGS -> group(clauseArgsToDoc(elementsOf(args.get(0))));
            case BITSTRING_SEGMENT -> bitstringSegmentToDoc(args.get(0), -1, ((IntegerLiteral) args.get(1)).value().intValue());
        };
    }

    private Doc callToDoc(Call call, Context context) {
        var name = call.name();
        var meta = call.meta();
        var args = call.args();

        switch (name) {
            case "<<>>":
                return binaryToDoc(meta, args);
            case "%":
                if (args.size() == 2 && args.get(1) instanceof Call map && map.name().equals("%{}")) {
                    return mapToDoc(map.meta(), toDoc(args.get(0), Context.PARENS_ARG), map.args());
                }
                break;
            case "%{}":
                return mapToDoc(meta, empty(), args);
            case "{}":
                return tupleToDoc(meta, args, Join.FLEX_BREAK);
            case Asts.BLOCK:
                return blockCallToDoc(call, context);
            case Asts.ALIASES:
                if (!args.isEmpty()) {
                    return aliasesToDoc(args, context);
                }
                break;
            case "&":
                if (args.size() == 1) {
                    return captureToDoc(args.get(0), context);
                }
                break;
            case "@":
                if (args.size() == 1) {
                    return moduleAttributeToDoc(meta, args.get(0), context);
                }
                break;
            case "not":
                if (args.size() == 1 && args.get(0) instanceof Call in && in.is("in", 2)) {
                    return binaryOpToDoc("in", "not in", meta, in.args().get(0), in.args().get(1), context);
                }
                break;
            case "..":
                if (args.isEmpty()) {
                    return text(context.isNoParensArg() ? "(..)" : "..");
                }
                break;
            case "...":
                if (args.isEmpty()) {
                    return text("...");
                }
                break;
            case "..//":
                if (args.size() == 3) {
                    var range = new Call("..", meta, List.of(args.get(0), args.get(1)));
                    return toDoc(new Call("//", meta, List.of(range, args.get(2))), context);
                }
                break;
            case "fn":
                if (!args.isEmpty()) {
                    return anonFunToDoc(args, line(meta), closingLine(meta), eol(meta));
                }
                break;
            default:
                break;
        }
        return sigilToDoc(call).orElseGet(() -> operatorOrLocalToDoc(call, context));
    }

    private Doc operatorOrLocalToDoc(Call call, Context context) {
        var args = call.args();

        if (args.size() == 1 && Operators.isUnary(call.name())) {
            return unaryOpToDoc(call.name(), args.get(0), context);
        }
        if (args.size() == 2 && Operators.isBinary(call.name())) {
            return binaryOpToDoc(call.name(), call.name(), call.meta(), args.get(0), args.get(1), context);
        }
        return localToDoc(call.name(), call.meta(), args, context);
    }

    private Doc applyToDoc(Apply apply, Context context) {
        var meta = apply.meta();
        var args = apply.args();

        if (Shapes.isRemote(apply, "Elixir.List", "to_charlist") && args.size() == 1 && args.get(0) instanceof ListLiteral entries) {
            return charlistInterpolationToDoc(apply, entries.elements(), context);
        }
        if (Shapes.isAtomFromBinary(apply)) {
            var entries = ((Call) args.get(0)).args();

            if (Shapes.isInterpolated(entries)) {
                return interpolationToDoc(entries, DOUBLE_QUOTE, ":\"", DOUBLE_QUOTE);
            }
            return remoteToDoc(apply, context);
        }
        if (Shapes.isRemote(apply, "Elixir.Access", "get") && args.size() == 2) {
            var target = ((Call) apply.target()).args().get(0);
            var arg = args.get(1);
            var accessed = Shapes.isKeyword(arg) ? elementsOf(arg) : List.of(arg);

            return concat(remoteTargetToDoc(target), listToDoc(meta, accessed));
        }
        return remoteToDoc(apply, context);
    }

    // Keyword entries and map entries
    private Doc pairToDoc(Pair pair, Context context) {
        var leftArg = pair.left();
        var rightArg = pair.right();
        Doc left;
        Doc right;
        String op;

        if (Shapes.isKeywordKey(leftArg)) {
            var atom = Asts.blockAtom(leftArg);

            if (atom.isPresent()) {
                left = color(text(AtomNames.key(atom.get())), Category.ATOM);
            } else {
                var entries = ((Call) ((Apply) leftArg).args().get(0)).args();
                left = interpolationToDoc(entries, DOUBLE_QUOTE, "\"", "\":");
            }
            right = toDoc(rightArg, context);
            op = "";
        } else {
            left = wrapInParensIfBinaryOperator(toDoc(leftArg, context), leftArg);
            right = toDoc(rightArg, context);
            op = " =>";
        }

        var separator = text(op);
        return concat(group(left),
                      withNextBreakFits(nextBreakFits(rightArg), right, doc -> nest(glue(separator, doc), 2, NestMode.BREAK)));
    }

    private Doc foreignToDoc(Ast ast) {
        String dump;

        if (ast instanceof AtomLiteral atom) {
            dump = AtomNames.inspect(atom.name());
        } else if (ast instanceof IntegerLiteral integer) {
            dump = integer.value().toString();
        } else if (ast instanceof FloatLiteral floating) {
            dump = Double.toString(floating.value());
        } else if (ast instanceof StringLiteral string) {
            dump = "\"" + string.value().replace("\\", "\\\\").replace("\"", "\\\"").replace("\n", "\\n") + "\"";
        } else if (ast instanceof Ast.Foreign foreign) {
            dump = String.valueOf(foreign.value());
            log.debug("No layout rule for foreign value {}, writing it as is", dump);
        } else {
            dump = String.valueOf(ast);
            log.debug("No layout rule for {}, writing it as is", dump);
        }
        return text(dump);
    }

    // === Literal wrappers ===

    private Doc blockCallToDoc(Call block, Context context) {
        var meta = block.meta();
        var args = block.args();

        if (args.isEmpty()) {
            return color(text("nil"), Category.NIL);
        }
        if (args.size() > 1) {
            return surround(text("("), blockToDoc(block, line(meta), closingLine(meta)), text(")"));
        }

        var arg = args.get(0);

        if (arg instanceof Pair pair) {
            return tupleToDoc(meta, List.of(pair.left(), pair.right()), Join.FLEX_BREAK);
        }
        if (arg instanceof ListLiteral list) {
            if (!list.elements().isEmpty() && isCall(list.elements().get(0), "->")) {
                return parenFunToDoc(list.elements(), LineRange.MAX_LINE, LineRange.MIN_LINE);
            }
            return listLiteralToDoc(meta, list.elements());
        }
        if (arg instanceof StringLiteral string) {
            return stringToDoc(meta, string.value());
        }
        if (arg instanceof AtomLiteral atom) {
            return atomToDoc(atom.name(), meta);
        }
        if (arg instanceof IntegerLiteral integer) {
            var token = meta.token().orElseGet(() -> integer.value().toString());
            return color(text(NumberLiterals.integer(token)), Category.NUMBER);
        }
        if (arg instanceof FloatLiteral floating) {
            var token = meta.token().orElseGet(() -> Double.toString(floating.value()));
            return color(text(NumberLiterals.floating(token)), Category.NUMBER);
        }
        if (arg instanceof Call splice && splice.is("unquote_splicing", 1)) {
            return wrapInParens(localToDoc(splice.name(), splice.meta(), splice.args(), context));
        }
        return toDoc(arg, context);
    }

    private Doc listLiteralToDoc(Meta meta, List<Ast> elements) {
        if (meta.hasDelimiter(SINGLE_HEREDOC)) {
            var quotes = charlistQuotes(true, List.of());
            var content = StringEscapes.escapeHeredoc(Shapes.charlistText(elements), quotes.closing());
            return forceUnfit(concat(text(quotes.opening()), content, text(quotes.closing())));
        }
        if (meta.hasDelimiter(SINGLE_QUOTE)) {
            var content = Shapes.charlistText(elements);
            var quotes = charlistQuotes(false, List.of(content));
            return concat(text(quotes.opening()), StringEscapes.escapeString(content, quotes.closing()), text(quotes.closing()));
        }
        return listToDoc(meta, elements);
    }

    private Doc stringToDoc(Meta meta, String value) {
        if (meta.hasDelimiter(DOUBLE_HEREDOC)) {
            var content = StringEscapes.escapeHeredoc(value, DOUBLE_HEREDOC);
            return forceUnfit(color(concat(text(DOUBLE_HEREDOC), content, text(DOUBLE_HEREDOC)), Category.STRING));
        }

        var content = StringEscapes.escapeString(value, DOUBLE_QUOTE);
        return color(concat(text(DOUBLE_QUOTE), content, text(DOUBLE_QUOTE)), Category.STRING);
    }

    private Doc atomToDoc(String name, Meta meta) {
        if (name.equals("true") || name.equals("false")) {
            return color(text(name), Category.BOOLEAN);
        }
        if (name.equals("nil")) {
            return color(text(name), Category.NIL);
        }
        // :\\ and :"\\" read the same, as escapes are kept as written
        if (name.equals("\\\\")) {
            var written = meta.hasDelimiter(DOUBLE_QUOTE) ? ":\"\\\\\"" : ":\\\\";
            return color(text(written), Category.ATOM);
        }

        return color(text(AtomNames.literal(name)), Category.ATOM);
    }

    private Doc aliasesToDoc(List<Ast> segments, Context context) {
        var head = segments.get(0);
        var doc = head instanceof AtomLiteral atom
                  ? text(atom.name())
                  : toDocWithParensIfOperator(head, context);

        for (var segment : segments.subList(1, segments.size())) {
            var name = segment instanceof AtomLiteral atom ? atom.name() : DocRenderer.renderPlain(toDoc(segment, context));
            doc = concat(doc, text("." + name));
        }
        return color(doc, Category.ATOM);
    }

    // === Blocks ===

    Doc blockToDoc(Ast block, int minLine, int maxLine) {
        if (block instanceof ListLiteral list && !list.elements().isEmpty() && isCall(list.elements().get(0), "->")) {
            return parenFunToDoc(list.elements(), minLine, maxLine);
        }
        if (block instanceof Call call && call.name().equals(Asts.BLOCK) && call.args().size() != 1) {
            return blockArgsToDoc(call.args(), minLine, maxLine);
        }
        return blockArgsToDoc(List.of(block), minLine, maxLine);
    }

    private Doc blockArgsToDoc(List<Ast> args, int minLine, int maxLine) {
        var docs = comments.interleave(args, List.of(), minLine, maxLine, LineRange::of, (arg, rest) -> {
            var newlines = arg.metaOrEmpty().endOfExpression().orElse(1);
            var doc = toDoc(arg, Context.BLOCK);
            return new Entry(doc, blockNextLine(arg), newlines);
        }).docs();

        if (docs.isEmpty()) {
            return empty();
        }
        if (docs.size() == 1) {
            return docs.get(0);
        }
        return forceUnfit(foldLines(docs));
    }

    // Module attributes stay together, everything else gets a blank line once it breaks
    private static Doc blockNextLine(Ast arg) {
        return isCall(arg, "@") ? empty() : softBreak("");
    }

    // === Operators ===

    private Doc unaryOpToDoc(String op, Ast arg, Context context) {
        var doc = toDoc(arg, context.manyArgsOr(Context.OPERAND));
        var nestable = (op.equals("!") || op.equals("not")) && isCall(arg, op, 1);

        if (!nestable) {
            doc = wrapInParensIfOperator(doc, arg);
        }

        var opString = op.equals("not") ? "not " : op;
        return concat(color(text(opString), Category.OPERATOR), doc);
    }

    private Doc binaryOpToDoc(String op, String opString, Meta meta, Ast left, Ast right, Context context) {
        return binaryOpToDoc(op, opString, meta, left, right, context, operandNesting);
    }

    private Doc binaryOpToDoc(String op, String opString, Meta meta, Ast leftArg, Ast rightArg, Context context, int nesting) {
        if (Operators.RIGHT_NEW_LINE_BEFORE.contains(op)) {
            return rightNewLineBeforeToDoc(op, opString, meta, leftArg, rightArg, context);
        }
        if (Operators.PIPELINE.contains(op)) {
            return pipelineToDoc(op, meta, leftArg, rightArg, context);
        }

        var info = binaryInfo(op);
        var left = binaryOperandToDoc(leftArg, context.leftOperand(), op, info, Associativity.LEFT, 2);
        var right = binaryOperandToDoc(rightArg, context.rightOperand(), op, info, Associativity.RIGHT, 0);
        String operator;

        if (Operators.NO_SPACE.contains(op)) {
            operator = opString;
            right = group(right);
        } else if (Operators.NO_NEWLINE.contains(op)) {
            operator = " " + opString + " ";
            right = group(right);
        } else {
            var eol = eol(meta);
            var nextBreakFits = Operators.NEXT_BREAK_FITS.contains(op) && nextBreakFits(rightArg) && !eol;

            operator = " " + opString;
            right = withNextBreakFits(nextBreakFits, right, doc -> {
                var nested = nest(concat(softBreak(), doc), nesting, NestMode.BREAK);
                return eol ? forceUnfit(nested) : nested;
            });
        }
        return concat(group(left), color(text(operator), Category.OPERATOR), group(right));
    }

    // a when b when c, a | b | c
    private Doc rightNewLineBeforeToDoc(String op, String opString, Meta meta, Ast leftArg, Ast rightArg, Context context) {
        var info = binaryInfo(op);
        var prefix = opString + " ";
        var minLine = leftArg.isNode() ? line(leftArg.metaOrEmpty()) : line(meta);
        var operands = new ArrayList<Operand>();

        operands.add(new Operand(Operand.Role.ROOT, op, context.leftOperand(), leftArg));
        var maxLine = unwrapRight(rightArg, op, meta, context.rightOperand(), operands);

        var doc = operandsWithComments(operands, meta, minLine, maxLine, context, operand -> {
            if (operand.role() == Operand.Role.ROOT) {
                return binaryOperandToDoc(operand.arg(), operand.context(), op, info, Associativity.LEFT, 2);
            }

            var side = operand.role() == Operand.Role.LEFT ? Associativity.LEFT : Associativity.RIGHT;
            var operandDoc = binaryOperandToDoc(operand.arg(), operand.context(), op, info, side, 0);

            operandDoc = nest(operandDoc, prefix.codePointCount(0, prefix.length()));
            if (Shapes.forceArgs(operand.arg())) {
                operandDoc = forceUnfit(operandDoc);
            }
            return concat(text(prefix), operandDoc);
        });

        if (Shapes.isKeyword(rightArg) && (context == Context.PARENS_ARG || context == Context.NO_PARENS_ARG)) {
            return wrapInParens(doc);
        }
        return doc;
    }

    private static int unwrapRight(Ast right, String op, Meta meta, Context context, List<Operand> operands) {
        var current = right;
        var currentMeta = meta;
        var currentContext = context;

        while (current instanceof Call call && call.is(op, 2)) {
            operands.add(new Operand(Operand.Role.LEFT, op, currentContext.leftOperand(), call.args().get(0)));
            currentContext = currentContext.rightOperand();
            currentMeta = call.meta();
            current = call.args().get(1);
        }
        operands.add(new Operand(Operand.Role.RIGHT, op, currentContext, current));
        return line(currentMeta);
    }

    // a |> b |> c
    private Doc pipelineToDoc(String op, Meta meta, Ast leftArg, Ast rightArg, Context context) {
        var info = binaryInfo(op);
        var maxLine = line(meta);
        var pipes = new ArrayList<Operand>();

        pipes.add(new Operand(Operand.Role.RIGHT, op, context.rightOperand(), rightArg));

        var current = leftArg;
        var currentMeta = meta;
        var currentContext = context.leftOperand();

        while (current instanceof Call call && call.args().size() == 2 && Operators.PIPELINE.contains(call.name())) {
            pipes.add(0, new Operand(Operand.Role.RIGHT, call.name(), currentContext.rightOperand(), call.args().get(1)));
            currentContext = currentContext.leftOperand();
            currentMeta = call.meta();
            current = call.args().get(0);
        }

        var minLine = current.isNode() ? line(current.metaOrEmpty()) : line(currentMeta);
        pipes.add(0, new Operand(Operand.Role.ROOT, op, currentContext, current));

        return operandsWithComments(pipes, meta, minLine, maxLine, context, operand -> {
            if (operand.role() == Operand.Role.ROOT) {
                return binaryOperandToDoc(operand.arg(), operand.context(), op, info, Associativity.LEFT, 2);
            }

            var pipe = operand.op();
            var doc = binaryOperandToDoc(operand.arg(), operand.context(), pipe, binaryInfo(pipe), Associativity.RIGHT, 0);
            return concat(text(pipe + " "), doc);
        });
    }

    private Doc operandsWithComments(List<Operand> operands,
                                     Meta meta,
                                     int minLine,
                                     int maxLine,
                                     Context context,
                                     Function<Operand, Doc> format) {
        var acc = new ArrayList<Entry>();
        var items = operands;

        // Comments cannot move in front of the first operand of a call without parentheses
        if (context == Context.NO_PARENS_ONE_ARG) {
            acc.add(Entry.of(format.apply(operands.get(0))));
            items = operands.subList(1, operands.size());
        }

        var interleaved = comments.interleave(items, acc, minLine, maxLine,
                                              operand -> LineRange.of(operand.arg()),
                                              (operand, rest) -> Entry.of(format.apply(operand)));

        if (interleaved.hasComments() || eol(meta)) {
            return forceUnfit(foldLines(interleaved.docs()));
        }
        return foldGlue(interleaved.docs());
    }

    private Doc binaryOperandToDoc(Ast operand,
                                   Context context,
                                   String parentOp,
                                   OperatorInfo parentInfo,
                                   Associativity side,
                                   int nesting) {
        // (not left) in right
        if (parentOp.equals("in") && side == Associativity.LEFT) {
            var content = Shapes.blockContent(operand);

            if (content.isPresent() && content.get() instanceof Call unary && unary.args().size() == 1
                && (unary.name().equals("not") || unary.name().equals("!"))) {
                return wrapInParens(unaryOpToDoc(unary.name(), unary.args().get(0), context));
            }
        }

        if (operand instanceof Call call && call.args().size() == 2 && Operators.isBinary(call.name())) {
            var op = call.name();
            var info = binaryInfo(op);
            var left = call.args().get(0);
            var right = call.args().get(1);

            if (parentInfo.associativity() == side && op.equals(parentOp) && !Operators.PARENS_EVEN_WHEN_PARENT.contains(op)) {
                return binaryOpToDoc(op, op, call.meta(), left, right, context, nesting);
            }
            if (needsParens(op, info, parentOp, parentInfo, side)) {
                return wrapInParens(binaryOpToDoc(op, op, call.meta(), left, right, context, 2));
            }
            return binaryOpToDoc(op, op, call.meta(), left, right, context, 2);
        }

        if (operand instanceof Call capture && capture.is("&", 1) && !(capture.args().get(0) instanceof IntegerLiteral)
            && (side == Associativity.LEFT
                || (parentInfo.associativity() == Associativity.LEFT && parentInfo.precedence() > Operators.CAPTURE_PRECEDENCE))) {
            return wrapInParens(toDoc(operand, context));
        }
        return toDoc(operand, context);
    }

    private static boolean needsParens(String op, OperatorInfo info, String parentOp, OperatorInfo parentInfo, Associativity side) {
        if (Operators.PARENS_ON_OPERANDS.contains(parentOp) && !Operators.NO_SPACE.contains(op)) {
            return true;
        }
        if (Operators.LOGICAL.contains(op) && Operators.LOGICAL.contains(parentOp)) {
            return true;
        }
        if (parentInfo.precedence() > info.precedence()) {
            return true;
        }
        return parentInfo.precedence() == info.precedence() && parentInfo.associativity() != side;
    }

    private static OperatorInfo binaryInfo(String op) {
        return Operators.binary(op)
                        .orElseThrow(() -> new IllegalStateException("Not a binary operator: " + op));
    }

    /**
     * One operand of a flattened operator chain.
     */
    private record Operand(Role role, String op, Context context, Ast arg) {
        enum Role {
            ROOT,
            LEFT,
            RIGHT
        }
    }

    // === Module attributes and captures ===

    private Doc moduleAttributeToDoc(Meta meta, Ast arg, Context context) {
        // @Foo.Bar
        if (arg instanceof Call aliases && aliases.name().equals(Asts.ALIASES) && aliases.args().size() >= 2) {
            return concat(text("@("), toDoc(arg, Context.PARENS_ARG), text(")"));
        }
        // @foo bar
        if (arg instanceof Call call && call.args().size() == 1
            && !call.name().equals(Asts.BLOCK) && !call.name().equals(Asts.ALIASES)) {
            if (AtomNames.classify(call.name()) != AtomNames.Kind.IDENTIFIER) {
                return unaryOpToDoc("@", arg, context);
            }

            var args = callArgsToDoc(call.args(), call.meta(), context, Parens.SKIP_UNLESS_MANY_ARGS, false);
            var doc = concat(text("@" + call.name()), args.doc());
            return args.wrapInParens() ? wrapInParens(doc) : doc;
        }
        return unaryOpToDoc("@", arg, context);
    }

    private Doc captureToDoc(Ast arg, Context context) {
        if (arg instanceof IntegerLiteral integer) {
            return text("&" + integer.value());
        }

        var doc = captureTargetToDoc(arg, context);
        var written = DocRenderer.renderPlain(doc);

        // & &1 and & 1 must keep the space
        if (written.startsWith("&") || (!written.isEmpty() && Character.isDigit(written.charAt(0)))) {
            return concat(text("& "), doc);
        }
        return concat(text("&"), doc);
    }

    private Doc captureTargetToDoc(Ast arg, Context context) {
        if (arg instanceof Call slash && slash.is("/", 2)) {
            var arity = Shapes.blockContent(slash.args().get(1))
                              .filter(IntegerLiteral.class::isInstance)
                              .map(value -> ((IntegerLiteral) value).value().toString());
            var fun = slash.args().get(0);

            // &Mod.fun/1
            if (arity.isPresent() && fun instanceof Apply apply && apply.args().isEmpty()
                && apply.target() instanceof Call dot && dot.is(".", 2)
                && dot.args().get(1) instanceof AtomLiteral name) {
                var target = remoteTargetToDoc(dot.args().get(0));
                return concat(nest(target, 1), text("." + AtomNames.remoteCall(name.name()) + "/" + arity.get()));
            }
            // &fun/1
            if (arity.isPresent() && fun instanceof Variable variable) {
                return text(variable.name() + "/" + arity.get());
            }
        }
        return wrapInParensIfOperator(toDoc(arg, context), arg);
    }

    // === Calls ===

    private Doc remoteToDoc(Apply apply, Context context) {
        var meta = apply.meta();
        var args = apply.args();

        if (apply.target() instanceof Call dot && dot.name().equals(".")) {
            // expression.{arguments}
            if (dot.args().size() == 2 && dot.args().get(1) instanceof AtomLiteral fun && fun.name().equals("{}")) {
                var target = remoteTargetToDoc(dot.args().get(0));
                return concat(target, text("."), tupleToDoc(meta, args, Join.BREAK));
            }
            // expression.(arguments)
            if (dot.args().size() == 1) {
                var target = remoteTargetToDoc(dot.args().get(0));
                var call = callArgsToDoc(args, meta, context, Parens.SKIP_IF_DO_END, true);
                var doc = concat(target, text("."), call.doc());
                return call.wrapInParens() ? wrapInParens(doc) : doc;
            }
            // Mod.function(arguments)
            if (dot.args().size() == 2 && dot.args().get(1) instanceof AtomLiteral fun) {
                var target = dot.args().get(0);
                var funDoc = color(text(AtomNames.remoteCall(fun.name())), Category.CALL);
                var remote = concat(remoteTargetToDoc(target), text("."), funDoc);

                if (args.isEmpty() && !Shapes.isModuleTarget(target) && meta.closing().isEmpty()) {
                    return remote;
                }

                var call = callArgsToDoc(args, meta, context, Parens.SKIP_IF_DO_END, true);
                var doc = concat(remote, call.doc());
                return call.wrapInParens() ? wrapInParens(doc) : doc;
            }
        }

        // call(call)(arguments)
        var target = toDoc(apply.target(), Context.NO_PARENS_ARG);
        var call = callArgsToDoc(args, meta, context, Parens.REQUIRED, true);
        var doc = concat(target, call.doc());
        return call.wrapInParens() ? wrapInParens(doc) : doc;
    }

    private Doc remoteTargetToDoc(Ast target) {
        if (target instanceof Call fn && fn.name().equals("fn") && !fn.args().isEmpty()) {
            return wrapInParens(toDoc(target, Context.NO_PARENS_ARG));
        }
        return toDocWithParensIfOperator(target, Context.NO_PARENS_ARG);
    }

    private Doc localToDoc(String name, Meta meta, List<Ast> args, Context context) {
        Parens parens;

        if (meta.closing().isPresent()) {
            parens = Parens.SKIP_IF_ONLY_DO_END;
        } else if (LocalWithoutParens.matches(name, args.size(), config.localsWithoutParens())) {
            parens = Parens.SKIP_UNLESS_MANY_ARGS;
        } else {
            parens = Parens.SKIP_IF_DO_END;
        }

        var call = callArgsToDoc(args, meta, context, parens, true);
        var doc = concat(color(text(name), Category.CALL), call.doc());
        return call.wrapInParens() ? wrapInParens(doc) : doc;
    }

    /**
     * Arguments of a call and whether the whole call must be wrapped in parentheses to stay unambiguous.
     */
    private record CallArgs(Doc doc, boolean wrapInParens) {}

    private CallArgs callArgsToDoc(List<Ast> args, Meta meta, Context context, Parens parens, boolean listToKeyword) {
        if (args.isEmpty()) {
            var argsDoc = argsWithComments(args, meta, false, LastArgMode.NONE, Join.BREAK, this::parensArg).doc();
            return new CallArgs(surround(text("("), argsDoc, text(")")), false);
        }

        var rest = args.subList(0, args.size() - 1);
        var last = args.get(args.size() - 1);
        var blocks = doEndBlocks(meta, last);

        if (blocks.isPresent()) {
            Doc callDoc;

            if (rest.isEmpty()) {
                callDoc = text(parens == Parens.REQUIRED ? "() do" : " do");
            } else {
                var noParens = parens != Parens.REQUIRED && parens != Parens.SKIP_IF_ONLY_DO_END;
                callDoc = callArgsNoBlocksToDoc(meta, rest, noParens, listToKeyword, text(" do"));
            }

            callDoc = forceUnfit(line(concat(callDoc, doEndBlocksToDoc(blocks.get())), text("end")));
            return new CallArgs(callDoc, context.isNoParensArg());
        }

        var noParens = parens == Parens.SKIP_UNLESS_MANY_ARGS
                       && (context == Context.BLOCK
                           || context == Context.OPERAND
                           || context == Context.NO_PARENS_ONE_ARG
                           || context == Context.PARENS_ONE_ARG);

        return new CallArgs(callArgsNoBlocksToDoc(meta, args, noParens, listToKeyword, empty()), false);
    }

    private Doc parensArg(Ast arg) {
        return toDoc(arg, Context.PARENS_ARG);
    }

    private Doc callArgsNoBlocksToDoc(Meta meta, List<Ast> args, boolean skipParens, boolean listToKeyword, Doc extra) {
        var left = args.subList(0, args.size() - 1);
        var last = lastArgToKeyword(args.get(args.size() - 1), listToKeyword, skipParens);
        var keyword = last.keyword();
        var right = keyword ? elementsOf(last.arg()) : List.of(last.arg());

        Context context;
        if (left.isEmpty() && !keyword) {
            context = skipParens ? Context.NO_PARENS_ONE_ARG : Context.PARENS_ONE_ARG;
        } else {
            context = skipParens ? Context.NO_PARENS_ARG : Context.PARENS_ARG;
        }

        var all = new ArrayList<Ast>(left);
        all.addAll(right);

        var manyEol = all.size() >= 2 && eol(meta);
        var noGenerators = all.stream().noneMatch(arg -> isCall(arg, "<-", 2));
        var keywordTail = !left.isEmpty() && keyword && noGenerators;
        Function<Ast, Doc> format = arg -> toDoc(arg, context);
        Doc argsDoc;
        boolean nextBreakFits;

        if (keywordTail) {
            var leftJoin = Shapes.forceArgs(left) || manyEol ? Join.LINE : Join.BREAK;
            var leftDoc = argsWithComments(left, meta.withoutClosing(), skipParens, LastArgMode.FORCE_COMMA, leftJoin, format).doc();

            var rightJoin = Shapes.forceArgs(right) || Shapes.forceArgs(all) || manyEol ? Join.LINE : Join.BREAK;
            var rightDoc = argsWithComments(right, meta, false, LastArgMode.NONE, rightJoin, format).doc();

            rightDoc = concat(rightJoin == Join.LINE ? hardLine() : softBreak(), rightDoc);

            if (skipParens) {
                argsDoc = nest(concat(leftDoc, group(rightDoc, GroupMode.OPTIMISTIC)), Indent.CURSOR, NestMode.BREAK);
            } else {
                rightDoc = group(concat(nest(rightDoc, 2, NestMode.BREAK), softBreak(""), text(")")), GroupMode.OPTIMISTIC);
                argsDoc = concat(nest(leftDoc, 2, NestMode.BREAK), rightDoc);
            }
            nextBreakFits = true;
        } else {
            var join = Shapes.forceArgs(all) || manyEol ? Join.LINE : Join.BREAK;

            nextBreakFits = join == Join.BREAK && nextBreakFits(last.arg());
            var mode = nextBreakFits ? LastArgMode.NEXT_BREAK_FITS : LastArgMode.NONE;

            argsDoc = ungroupIfGroup(argsWithComments(all, meta, skipParens, mode, join, format).doc());
            argsDoc = skipParens
                      ? nest(argsDoc, Indent.CURSOR, NestMode.BREAK)
                      : concat(nest(argsDoc, 2, NestMode.BREAK), softBreak(""), text(")"));
        }

        Doc doc;
        if (keywordTail && skipParens) {
            doc = concat(nest(concat(text(" "), argsDoc), 2), extra);
        } else if (skipParens) {
            doc = concat(text(" "), argsDoc, extra);
        } else {
            doc = concat(nest(concat(text("("), softBreak("")), 2, NestMode.BREAK), argsDoc, extra);
        }
        return nextBreakFits ? group(doc, GroupMode.PESSIMISTIC) : group(doc);
    }

    private record KeywordArg(boolean keyword, Ast arg) {}

    // A literal list in last position is written as trailing keywords when it holds only pairs
    private KeywordArg lastArgToKeyword(Ast arg, boolean listToKeyword, boolean skipParens) {
        if (arg instanceof ListLiteral list && !list.elements().isEmpty()) {
            return new KeywordArg(Shapes.isKeyword(list), list);
        }

        var content = Shapes.blockContent(arg);

        if (!listToKeyword || content.isEmpty() || !(content.get() instanceof ListLiteral list) || list.elements().isEmpty()) {
            return new KeywordArg(false, arg);
        }
        if (!Shapes.isKeyword(list)) {
            return new KeywordArg(false, arg);
        }
        if (skipParens) {
            var blockLine = line(arg.metaOrEmpty());
            var firstKey = ((Pair) list.elements().get(0)).left();

            // A comment before the first key would end up outside of the brackets
            if (comments.firstLineAfter(blockLine) <= line(firstKey.metaOrEmpty())) {
                return new KeywordArg(false, arg);
            }
        }
        return new KeywordArg(true, list);
    }

    // === Do/end blocks ===

    private record DoEndBlock(String key, int line, int endLine, Ast value) {}

    private Optional<List<DoEndBlock>> doEndBlocks(Meta meta, Ast last) {
        if (!(last instanceof ListLiteral list) || list.elements().isEmpty()) {
            return Optional.empty();
        }

        var keys = new ArrayList<String>();
        var lines = new ArrayList<Integer>();

        for (var element : list.elements()) {
            if (!(element instanceof Pair pair) || Asts.blockAtom(pair.left()).isEmpty()) {
                return Optional.empty();
            }
            keys.add(Asts.blockAtom(pair.left()).get());
            lines.add(line(pair.left().metaOrEmpty()));
        }

        if (!keys.get(0).equals("do")) {
            return Optional.empty();
        }
        if (meta.doBlock().isEmpty() && !canForceDoEndBlocks(keys.subList(1, keys.size()))) {
            return Optional.empty();
        }

        var blocks = new ArrayList<DoEndBlock>();

        for (int i = 0; i < keys.size(); i++) {
            var blockEnd = i + 1 < keys.size() ? lines.get(i + 1) : endLine(meta);
            blocks.add(new DoEndBlock(keys.get(i), lines.get(i), blockEnd, ((Pair) list.elements().get(i)).right()));
        }
        return Optional.of(blocks);
    }

    private boolean canForceDoEndBlocks(List<String> otherKeys) {
        return config.forceDoEndBlocks() && otherKeys.stream().allMatch(Shapes::isDoEndKeyword);
    }

    private Doc doEndBlocksToDoc(List<DoEndBlock> blocks) {
        var first = blocks.get(0);
        var doc = doEndBlockToDoc(empty(), first);

        for (var block : blocks.subList(1, blocks.size())) {
            doc = line(doc, doEndBlockToDoc(text(block.key()), block));
        }
        return doc;
    }

    private Doc doEndBlockToDoc(Doc key, DoEndBlock block) {
        var value = clausesToDoc(block.value(), block.line(), block.endLine());

        if (isEmpty(value)) {
            return key;
        }
        return nest(line(key, value), 2);
    }

    // === Interpolation and sigils ===

    private Doc binaryToDoc(Meta meta, List<Ast> entries) {
        if (entries.isEmpty()) {
            return text("<<>>");
        }
        if (!Shapes.isInterpolated(entries)) {
            return bitstringToDoc(meta, entries);
        }
        if (meta.hasDelimiter(DOUBLE_HEREDOC)) {
            return forceUnfit(interpolationToDoc(prependHeredocLine(entries), DOUBLE_HEREDOC, DOUBLE_HEREDOC, DOUBLE_HEREDOC));
        }
        return interpolationToDoc(entries, DOUBLE_QUOTE, DOUBLE_QUOTE, DOUBLE_QUOTE);
    }

    private Doc charlistInterpolationToDoc(Apply apply, List<Ast> entries, Context context) {
        if (!Shapes.isListInterpolated(entries)) {
            return remoteToDoc(apply, context);
        }
        if (apply.meta().hasDelimiter(SINGLE_HEREDOC)) {
            var quotes = charlistQuotes(true, List.of());
            return forceUnfit(interpolationToDoc(prependHeredocLine(entries), quotes.closing(), quotes.opening(), quotes.closing()));
        }

        var chunks = new ArrayList<String>();
        for (var entry : entries) {
            if (entry instanceof StringLiteral string) {
                chunks.add(string.value());
            }
        }

        var quotes = charlistQuotes(false, chunks);
        return interpolationToDoc(entries, quotes.closing(), quotes.opening(), quotes.closing());
    }

    private static List<Ast> prependHeredocLine(List<Ast> entries) {
        var result = new ArrayList<Ast>();

        if (!entries.isEmpty() && entries.get(0) instanceof StringLiteral first) {
            result.add(new StringLiteral("\n" + first.value()));
            result.addAll(entries.subList(1, entries.size()));
        } else {
            result.add(new StringLiteral("\n"));
            result.addAll(entries);
        }
        return result;
    }

    /**
     * Write string parts escaped for {@code escape} and interpolated expressions as {@code #{...}}.
     */
    private Doc interpolationToDoc(List<Ast> entries, String escape, String opening, String closing) {
        var doc = text(opening);

        for (var entry : entries) {
            if (entry instanceof StringLiteral string) {
                doc = concat(doc, StringEscapes.escapeString(string.value(), escape));
            } else {
                doc = concat(doc, interpolatedToDoc(Shapes.interpolatedExpression(entry)));
            }
        }
        return concat(doc, text(closing));
    }

    private Doc interpolatedToDoc(Ast quoted) {
        var saved = skipEol;

        skipEol = true;
        try {
            var doc = blockToDoc(quoted, LineRange.MAX_LINE, LineRange.MIN_LINE);
            return noLimit(surround(text("#{"), doc, text("}")));
        } finally {
            skipEol = saved;
        }
    }

    private Optional<Doc> sigilToDoc(Call call) {
        var args = call.args();
        var opening = call.meta().delimiter();

        if (!Shapes.isSigilCall(call) || args.size() != 2 || opening.isEmpty()
            || !(args.get(0) instanceof Call content && content.name().equals("<<>>"))
            || !(args.get(1) instanceof ListLiteral modifierList)) {
            return Optional.empty();
        }

        var name = call.name().substring(Shapes.SIGIL_PREFIX.length());
        var delimiter = opening.get();
        var modifiers = Shapes.charlistText(modifierList.elements());
        var entries = content.args();
        var callback = config.sigil(name);

        if (callback.isPresent()) {
            var metadata = new SigilMetadata(config.file(), call.meta().line(), name, modifiers, delimiter);
            var result = callback.get().apply(firstString(entries), metadata);
            entries = List.of(new StringLiteral(sigilText(name, result)));
        }

        var start = "~" + name + delimiter;

        if (delimiter.equals(DOUBLE_HEREDOC) || delimiter.equals(SINGLE_HEREDOC)) {
            var doc = interpolationToDoc(prependHeredocLine(entries), delimiter, start, delimiter + modifiers);
            return Optional.of(forceUnfit(doc));
        }

        var escape = closingSigilDelimiter(delimiter);
        return Optional.of(interpolationToDoc(entries, escape, start, escape + modifiers));
    }

    private static String firstString(List<Ast> entries) {
        if (!entries.isEmpty() && entries.get(0) instanceof StringLiteral string) {
            return string.value();
        }
        return "";
    }

    private static String sigilText(String sigil, Object result) {
        var builder = new StringBuilder();

        if (!appendText(result, builder)) {
            throw new FormatException(new FormatError.SigilCallbackResult(sigil, result));
        }
        return builder.toString();
    }

    private static boolean appendText(Object value, StringBuilder builder) {
        if (value instanceof CharSequence text) {
            builder.append(text);
            return true;
        }
        if (value instanceof Character character) {
            builder.append(character.charValue());
            return true;
        }
        if (value instanceof Iterable<?> parts) {
            for (var part : parts) {
                if (!appendText(part, builder)) {
                    return false;
                }
            }
            return true;
        }
        return false;
    }

    private static String closingSigilDelimiter(String opening) {
        return switch (opening) {
            case "(" -> ")";
            case "[" -> "]";
            case "{" -> "}";
            case "<" -> ">";
            default -> opening;
        };
    }

    private record Quotes(String opening, String closing) {}

    private Quotes charlistQuotes(boolean heredoc, List<String> chunks) {
        var sigils = config.migrates(Migration.CHARLISTS_AS_SIGILS);

        if (heredoc) {
            return sigils ? new Quotes("~c" + DOUBLE_HEREDOC, DOUBLE_HEREDOC) : new Quotes(SINGLE_HEREDOC, SINGLE_HEREDOC);
        }
        if (!sigils) {
            return new Quotes(SINGLE_QUOTE, SINGLE_QUOTE);
        }
        if (chunks.stream().anyMatch(chunk -> chunk.contains(DOUBLE_QUOTE))) {
            return new Quotes("~c" + SINGLE_QUOTE, SINGLE_QUOTE);
        }
        return new Quotes("~c" + DOUBLE_QUOTE, DOUBLE_QUOTE);
    }

    // === Bitstrings ===

    private record Segment(Ast ast, int index) {}

    private Doc bitstringToDoc(Meta meta, List<Ast> entries) {
        var last = entries.size() - 1;
        var join = eol(meta) ? Join.LINE : Join.FLEX_BREAK;
        var segments = new ArrayList<Segment>();

        for (int i = 0; i < entries.size(); i++) {
            segments.add(new Segment(entries.get(i), i));
        }

        var args = argsWithComments(segments, meta, false, LastArgMode.NONE, join,
                                    segment -> bitstringSegmentToDoc(segment.ast(), segment.index(), last),
                                    segment -> LineRange.of(segment.ast()));

        if (args.join() == Join.FLEX_BREAK) {
            return group(concat(nest(concat(text("<<"), args.doc()), 2), text(">>")));
        }
        return surround(text("<<"), args.doc(), text(">>"));
    }

    private Doc bitstringSegmentToDoc(Ast segment, int index, int last) {
        if (segment instanceof Call generator && generator.is("<-", 2)) {
            var left = new Special(Special.Kind.BITSTRING_SEGMENT,
                                   generator.meta(),
                                   List.of(generator.args().get(0), new IntegerLiteral(BigInteger.valueOf(last))));
            var doc = toDoc(new Call("<-", generator.meta(), List.of(left, generator.args().get(1))), Context.PARENS_ARG);
            return bitstringWrapParens(doc, index, last);
        }
        if (segment instanceof Call typed && typed.is("::", 2)) {
            var doc = toDoc(typed.args().get(0), Context.PARENS_ARG);
            var spec = bitstringSpecToDoc(typed.args().get(1), "::");

            if (index == last) {
                spec = bitstringWrapParens(spec, index, last);
            }
            return concat(bitstringWrapParens(doc, index, -1), text("::"), spec);
        }
        return bitstringWrapParens(toDoc(segment, Context.PARENS_ARG), index, last);
    }

    private Doc bitstringSpecToDoc(Ast spec, String parentOp) {
        if (spec instanceof Call call && call.args().size() == 2 && (call.name().equals("-") || call.name().equals("*"))) {
            var left = bitstringSpecToDoc(call.args().get(0), call.name());
            var right = toDocWithParensIfOperator(call.args().get(1), Context.PARENS_ARG);
            var doc = concat(left, text(call.name()), right);
            return parentOp.equals("*") ? wrapInParens(doc) : doc;
        }
        return toDocWithParensIfOperator(spec, Context.PARENS_ARG);
    }

    // The first and last segments must not touch the << and >> delimiters
    private static Doc bitstringWrapParens(Doc doc, int index, int last) {
        if (index != 0 && index != last) {
            return doc;
        }

        var written = DocRenderer.renderPlain(doc);

        if ((index == 0 && (written.startsWith("~") || written.startsWith("<<"))) || (index == last && written.endsWith(">>"))) {
            return wrapInParens(doc);
        }
        return doc;
    }

    // === Containers ===

    private Doc listToDoc(Meta meta, List<Ast> elements) {
        var join = eol(meta) ? Join.LINE : Join.BREAK;
        var args = argsWithComments(elements, meta, false, LastArgMode.NONE, join, this::parensArg).doc();

        return surround(color(text("["), Category.LIST), args, color(text("]"), Category.LIST));
    }

    private Doc mapToDoc(Meta meta, Doc name, List<Ast> entries) {
        var join = eol(meta) ? Join.LINE : Join.BREAK;

        // %{map | key: value}
        if (entries.size() == 1 && entries.get(0) instanceof Call update && update.is("|", 2)) {
            var left = update.args().get(0);
            var leftDoc = wrapInParensIfBinaryOperator(parensArg(left), left);
            var rightDoc = argsWithComments(elementsOf(update.args().get(1)), meta, false, LastArgMode.NONE, join, this::parensArg).doc();

            return mapEntriesToDoc(name, glue(leftDoc, concat(text("| "), nest(rightDoc, 2))));
        }

        var args = argsWithComments(entries, meta, false, LastArgMode.NONE, join, this::parensArg).doc();
        return mapEntriesToDoc(name, args);
    }

    private Doc mapEntriesToDoc(Doc name, Doc entries) {
        var opening = color(concat(text("%"), name, text("{")), Category.MAP);
        return surround(opening, entries, color(text("}"), Category.MAP));
    }

    private Doc tupleToDoc(Meta meta, List<Ast> elements, Join join) {
        var effective = eol(meta) ? Join.LINE : join;
        var args = argsWithComments(elements, meta, false, LastArgMode.NONE, effective, this::parensArg);
        var opening = color(text("{"), Category.TUPLE);
        var closing = color(text("}"), Category.TUPLE);

        if (args.join() == Join.FLEX_BREAK) {
            return group(concat(nest(concat(opening, args.doc()), 1), closing));
        }
        return surround(opening, args.doc(), closing);
    }

    /**
     * Arguments joined as requested and the join actually used: comments force one argument per line.
     */
    private record ArgsDoc(Doc doc, Join join) {}

    private ArgsDoc argsWithComments(List<Ast> args,
                                     Meta meta,
                                     boolean skipParens,
                                     LastArgMode lastArgMode,
                                     Join join,
                                     Function<Ast, Doc> format) {
        return argsWithComments(args, meta, skipParens, lastArgMode, join, format, LineRange::of);
    }

    private <T> ArgsDoc argsWithComments(List<T> args,
                                         Meta meta,
                                         boolean skipParens,
                                         LastArgMode lastArgMode,
                                         Join join,
                                         Function<T, Doc> format,
                                         Function<T, LineRange> span) {
        CommentInterleaver.EntryFunction<T> entry = (arg, rest) -> {
            var doc = format.apply(arg);

            if (!rest.isEmpty()) {
                return Entry.of(concatToLastGroup(doc, ","));
            }
            return Entry.of(switch (lastArgMode) {
                case FORCE_COMMA -> concatToLastGroup(doc, ",");
                case NEXT_BREAK_FITS -> group(ungroupIfGroup(doc), GroupMode.OPTIMISTIC);
                case NONE -> doc;
            });
        };

        var acc = new ArrayList<Entry>();
        var items = args;

        // Without parentheses there is no place to move comments of the first argument to
        if (skipParens && !args.isEmpty()) {
            acc.add(entry.apply(args.get(0), args.subList(1, args.size())));
            items = args.subList(1, args.size());
        }

        var interleaved = comments.interleave(items, acc, line(meta), closingLine(meta), span, entry);
        var docs = interleaved.docs();

        if (docs.isEmpty()) {
            return new ArgsDoc(empty(), Join.EMPTY);
        }
        if (join == Join.LINE || interleaved.hasComments()) {
            return new ArgsDoc(forceUnfit(foldLines(docs)), Join.LINE);
        }
        if (join == Join.FLEX_BREAK) {
            return new ArgsDoc(fold(docs, (left, right) -> flexGlue(left, right)), Join.FLEX_BREAK);
        }
        return new ArgsDoc(foldGlue(docs), Join.BREAK);
    }

    private static Doc manyArgs(List<Ast> args, Function<Ast, Doc> format) {
        var doc = format.apply(args.get(0));

        for (var arg : args.subList(1, args.size())) {
            doc = glue(concat(doc, text(",")), format.apply(arg));
        }
        return doc;
    }

    // === Anonymous functions and clauses ===

    private Doc anonFunToDoc(List<Ast> clauses, int minLine, int maxLine, boolean multiClauseStyle) {
        if (clauses.size() == 1 && clauses.get(0) instanceof Call clause && clause.is("->", 2)) {
            var meta = clause.meta();
            var args = elementsOf(clause.args().get(0));
            var body = clause.args().get(1);
            var separator = softBreak();

            // fn -> body end
            if (args.isEmpty()) {
                var bodyDoc = blockToDoc(body, line(meta), maxLine);
                var doc = concat(nest(concat(text("fn ->"), separator, bodyDoc), 2), separator, text("end"));
                return group(maybeForceClauses(doc, clauses));
            }
            // fn x -> y end
            if (!multiClauseStyle) {
                var clauseLine = line(meta);
                var argsDoc = clauseArgsToDoc(args, clauseLine);
                var bodyDoc = blockToDoc(body, clauseLine, maxLine);
                var head = group(nest(concat(ungroupIfGroup(argsDoc), text(" ->")), Indent.CURSOR));
                var doc = concat(nest(concat(text("fn "), head, separator, bodyDoc), 2), separator, text("end"));
                return group(maybeForceClauses(doc, clauses));
            }
        }

        var clausesDoc = clausesToDoc(new ListLiteral(clauses), minLine, maxLine);
        return forceUnfit(line(nest(line(text("fn"), clausesDoc), 2), text("end")));
    }

    // (args -> body) in typespecs
    private Doc parenFunToDoc(List<Ast> clauses, int minLine, int maxLine) {
        if (clauses.size() == 1 && clauses.get(0) instanceof Call clause && clause.is("->", 2)) {
            var meta = clause.meta();
            var args = elementsOf(clause.args().get(0));
            var body = clause.args().get(1);

            if (args.isEmpty()) {
                var bodyDoc = blockToDoc(body, line(meta), maxLine);
                var doc = concat(text("(-> "), nest(bodyDoc, Indent.CURSOR), text(")"));
                return group(maybeForceClauses(doc, clauses));
            }

            var clauseLine = line(meta);
            var argsDoc = clauseArgsToDoc(args, clauseLine);
            var bodyDoc = blockToDoc(body, clauseLine, maxLine);
            var head = group(concat(ungroupIfGroup(argsDoc), text(" ->")));
            var doc = concat(head, nest(concat(clauseBreakOrLine(clauses), bodyDoc), 2));
            return group(maybeForceClauses(wrapInParens(doc), clauses));
        }

        var clausesDoc = clausesToDoc(new ListLiteral(clauses), minLine, maxLine);
        return forceUnfit(line(nest(line(text("("), clausesDoc), 2), text(")")));
    }

    private boolean isMultiLineClauses(List<Ast> clauses) {
        for (var clause : clauses) {
            if (clause instanceof Call arrow && arrow.is("->", 2)
                && (eol(arrow.meta()) || Shapes.isMultiLineBlock(arrow.args().get(1)))) {
                return true;
            }
        }
        return false;
    }

    private Doc clauseBreakOrLine(List<Ast> clauses) {
        return isMultiLineClauses(clauses) ? hardLine() : softBreak();
    }

    private Doc maybeForceClauses(Doc doc, List<Ast> clauses) {
        return isMultiLineClauses(clauses) ? forceUnfit(doc) : doc;
    }

    private Doc clausesToDoc(Ast value, int minLine, int maxLine) {
        if (value instanceof ListLiteral list && !list.elements().isEmpty() && isCall(list.elements().get(0), "->")) {
            var clauses = withClosingOnLastClause(list.elements(), maxLine);
            var doc = clauseToDoc(clauses.get(0), minLine);

            for (var clause : clauses.subList(1, clauses.size())) {
                doc = line(concat(doc, maybeEmptyLine()), clauseToDoc(clause, minLine));
            }
            return group(maybeForceClauses(doc, clauses));
        }

        var doc = blockToDoc(value, minLine, maxLine);
        return isEmpty(doc) ? doc : group(doc);
    }

    private static List<Ast> withClosingOnLastClause(List<Ast> clauses, int maxLine) {
        var result = new ArrayList<>(clauses);
        var lastIndex = result.size() - 1;

        if (result.get(lastIndex) instanceof Call last) {
            result.set(lastIndex, new Call(last.name(), last.meta().withClosing(Meta.Mark.at(maxLine)), last.args()));
        }
        return result;
    }

    private Doc clauseToDoc(Ast clause, int minLine) {
        if (!(clause instanceof Call arrow) || !arrow.is("->", 2)) {
            return toDoc(clause, Context.BLOCK);
        }

        var meta = arrow.meta();
        var args = elementsOf(arrow.args().get(0));
        var body = arrow.args().get(1);

        if (args.isEmpty()) {
            var bodyDoc = blockToDoc(body, line(meta), closingLine(meta));
            return nest(glue(text("() ->"), bodyDoc), 2);
        }

        var nesting = operandNesting;
        Doc argsDoc;

        operandNesting = nesting + 2;
        try {
            argsDoc = clauseArgsToDoc(args, minLine);
        } finally {
            operandNesting = nesting;
        }

        var bodyDoc = blockToDoc(body, minLine, closingLine(meta));
        return concat(group(concat(ungroupIfGroup(argsDoc), text(" ->"))), nest(concat(softBreak(), bodyDoc), 2));
    }

    private Doc clauseArgsToDoc(List<Ast> args, int minLine) {
        var interleaved = comments.interleave(List.of(args), List.of(), minLine, LineRange.MIN_LINE,
                                              LineRange::of,
                                              (clauseArgs, rest) -> Entry.of(clauseArgsToDoc(clauseArgs)));

        return interleaved.hasComments()
               ? foldLines(interleaved.docs())
               : foldGlue(interleaved.docs());
    }

    private Doc clauseArgsToDoc(List<Ast> args) {
        // fn a, b when c -> d end
        if (args.size() == 1 && args.get(0) instanceof Call when && when.name().equals("when") && !when.args().isEmpty()) {
            var whenArgs = when.args();
            var guard = whenArgs.get(whenArgs.size() - 1);
            var heads = new ArrayList<Ast>();

            for (var head : whenArgs.subList(0, whenArgs.size() - 1)) {
                heads.add(head instanceof ListLiteral keyword && !keyword.elements().isEmpty()
                          ? Asts.block(Meta.EMPTY, keyword)
                          : head);
            }

            var left = new Special(Special.Kind.CLAUSE_ARGS, when.meta(), List.of(new ListLiteral(heads)));
            return binaryOpToDoc("when", "when", when.meta(), left, guard, Context.NO_PARENS_ARG);
        }
        if (args.isEmpty()) {
            return text("()");
        }
        return manyArgs(args, arg -> toDoc(arg, Context.NO_PARENS_ARG));
    }

    // === Layout helpers ===

    private Doc toDocWithParensIfOperator(Ast ast, Context context) {
        return wrapInParensIfOperator(toDoc(ast, context), ast);
    }

    private static Doc wrapInParensIfOperator(Doc doc, Ast ast) {
        var content = Shapes.blockContent(ast);

        if (content.isPresent()) {
            return wrapInParensIfOperator(doc, content.get());
        }
        if (Shapes.isOperator(ast) && !Shapes.isModuleAttributeRead(ast) && !Shapes.isIntegerCapture(ast)) {
            return wrapInParens(doc);
        }
        return doc;
    }

    private static Doc wrapInParensIfBinaryOperator(Doc doc, Ast ast) {
        return Shapes.isBinaryOperator(ast) ? wrapInParens(doc) : doc;
    }

    private static Doc wrapInParens(Doc doc) {
        return concat(text("("), nest(doc, Indent.CURSOR), text(")"));
    }

    private static Doc withNextBreakFits(boolean nextBreakFits, Doc doc, UnaryOperator<Doc> wrap) {
        if (nextBreakFits) {
            return group(wrap.apply(group(doc, GroupMode.OPTIMISTIC)), GroupMode.PESSIMISTIC);
        }
        return group(wrap.apply(group(doc)));
    }

    /**
     * Whether the argument may break on its own while the code in front of it stays on one line:
     * containers written over several lines, heredocs, anonymous functions, maps and structs.
     */
    private boolean nextBreakFits(Ast ast) {
        if (ast instanceof Pair pair) {
            return Asts.blockAtom(pair.left()).isPresent() && nextBreakFits(pair.right());
        }
        if (ast instanceof Apply apply) {
            if (Shapes.isRemote(apply, "Elixir.List", "to_charlist")) {
                return apply.args().size() == 1
                       && apply.args().get(0) instanceof ListLiteral list
                       && !list.elements().isEmpty()
                       && apply.meta().hasDelimiter(SINGLE_HEREDOC);
            }
            return apply.target() instanceof Call dot
                   && dot.is(".", 2)
                   && dot.args().get(1) instanceof AtomLiteral fun
                   && fun.name().equals("{}");
        }
        if (!(ast instanceof Call call)) {
            return false;
        }

        var meta = call.meta();
        var args = call.args();

        if (call.name().equals("{}")) {
            return eolOrComments(meta);
        }
        if (call.name().equals(Asts.BLOCK) && args.size() == 1) {
            var content = args.get(0);

            if (content instanceof Pair) {
                return eolOrComments(meta);
            }
            if (content instanceof StringLiteral) {
                return meta.hasDelimiter(DOUBLE_HEREDOC);
            }
            if (content instanceof ListLiteral) {
                return !meta.hasDelimiter(SINGLE_QUOTE);
            }
        }
        if (call.name().equals("<<>>") && !args.isEmpty()) {
            return meta.hasDelimiter(DOUBLE_HEREDOC) || (!Shapes.isInterpolated(args) && eolOrComments(meta));
        }
        if ((call.name().equals("fn") || call.name().equals("%{}") || call.name().equals("%")) && !args.isEmpty()) {
            return true;
        }
        return (meta.hasDelimiter(DOUBLE_HEREDOC) || meta.hasDelimiter(SINGLE_HEREDOC)) && Shapes.isSigilCall(call);
    }

    private boolean eolOrComments(Meta meta) {
        return eol(meta) || comments.anyBetween(line(meta), closingLine(meta));
    }

    private boolean eol(Meta meta) {
        return !skipEol && meta.newlines() > 0;
    }

    /**
     * Append text to the innermost trailing group, so a trailing comma stays attached to
     * the argument and does not break on its own.
     */
    private static Doc concatToLastGroup(Doc doc, String suffix) {
        if (doc instanceof Doc.Concat concat) {
            return concat(concat.left(), concatToLastGroup(concat.right(), suffix));
        }
        if (doc instanceof Doc.Group group) {
            return group(concat(group.doc(), text(suffix)), group.mode());
        }
        return concat(doc, text(suffix));
    }

    private static Doc ungroupIfGroup(Doc doc) {
        return doc instanceof Doc.Group group ? group.doc() : doc;
    }

    private static Doc maybeEmptyLine() {
        return nest(softBreak(""), Indent.RESET);
    }

    private static Doc surround(Doc left, Doc doc, Doc right) {
        if (isEmpty(doc)) {
            return concat(left, right);
        }
        return group(glue(nest(glue(left, "", doc), 2, NestMode.BREAK), "", right));
    }

    private Doc color(Doc doc, Category category) {
        var colors = config.syntaxColors();

        return colors.colorOf(category)
                     .map(open -> Docs.color(doc, open, colors.reset()))
                     .orElse(doc);
    }

    private static Doc foldLines(List<Doc> docs) {
        return fold(docs, (left, right) -> line(left, right));
    }

    private static Doc foldGlue(List<Doc> docs) {
        return fold(docs, (left, right) -> glue(left, right));
    }

    private static Doc fold(List<Doc> docs, BinaryOperator<Doc> join) {
        var result = docs.get(0);

        for (var doc : docs.subList(1, docs.size())) {
            result = join.apply(result, doc);
        }
        return result;
    }

    private static List<Ast> elementsOf(Ast ast) {
        return ast instanceof ListLiteral list ? list.elements() : List.of(ast);
    }
}
