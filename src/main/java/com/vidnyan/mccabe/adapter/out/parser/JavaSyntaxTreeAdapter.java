package com.vidnyan.mccabe.adapter.out.parser;

import com.github.javaparser.JavaParser;
import com.github.javaparser.ParseResult;
import com.github.javaparser.ParserConfiguration;
import com.github.javaparser.Problem;
import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.body.BodyDeclaration;
import com.github.javaparser.ast.body.CallableDeclaration;
import com.github.javaparser.ast.body.CompactConstructorDeclaration;
import com.github.javaparser.ast.body.ConstructorDeclaration;
import com.github.javaparser.ast.body.EnumConstantDeclaration;
import com.github.javaparser.ast.body.EnumDeclaration;
import com.github.javaparser.ast.body.FieldDeclaration;
import com.github.javaparser.ast.body.InitializerDeclaration;
import com.github.javaparser.ast.body.MethodDeclaration;
import com.github.javaparser.ast.body.TypeDeclaration;
import com.github.javaparser.ast.stmt.BlockStmt;
import com.github.javaparser.ast.stmt.CatchClause;
import com.github.javaparser.ast.stmt.DoStmt;
import com.github.javaparser.ast.stmt.ForEachStmt;
import com.github.javaparser.ast.stmt.ForStmt;
import com.github.javaparser.ast.stmt.IfStmt;
import com.github.javaparser.ast.stmt.LabeledStmt;
import com.github.javaparser.ast.stmt.LocalClassDeclarationStmt;
import com.github.javaparser.ast.stmt.LocalRecordDeclarationStmt;
import com.github.javaparser.ast.stmt.Statement;
import com.github.javaparser.ast.stmt.SwitchEntry;
import com.github.javaparser.ast.stmt.SwitchStmt;
import com.github.javaparser.ast.stmt.SynchronizedStmt;
import com.github.javaparser.ast.stmt.TryStmt;
import com.github.javaparser.ast.stmt.WhileStmt;
import com.vidnyan.mccabe.application.port.out.SyntaxTreeParser;
import com.vidnyan.mccabe.domain.tree.ClassDef;
import com.vidnyan.mccabe.domain.tree.ForLoop;
import com.vidnyan.mccabe.domain.tree.FunctionDef;
import com.vidnyan.mccabe.domain.tree.IfBranch;
import com.vidnyan.mccabe.domain.tree.ModuleNode;
import com.vidnyan.mccabe.domain.tree.SimpleStatement;
import com.vidnyan.mccabe.domain.tree.SyntaxNode;
import com.vidnyan.mccabe.domain.tree.WhileLoop;
import com.vidnyan.mccabe.domain.tree.WithBlock;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * JavaParser-based implementation of SyntaxTreeParser.
 * Maps a Java compilation unit onto the language-neutral syntax tree:
 * types become class scopes, methods and constructors become functions,
 * initializer blocks are inlined into the class body.
 */
@Slf4j
@Component
public class JavaSyntaxTreeAdapter implements SyntaxTreeParser {

    private final ParserConfiguration configuration = new ParserConfiguration()
            .setLanguageLevel(ParserConfiguration.LanguageLevel.JAVA_17);

    @Override
    public ParsingResult parse(String fileName, String source) {
        // JavaParser instances are not thread-safe
        JavaParser parser = new JavaParser(configuration);
        ParseResult<CompilationUnit> result = parser.parse(source);

        if (!result.isSuccessful() || result.getResult().isEmpty()) {
            List<String> problems = result.getProblems().stream()
                    .map(Problem::getVerboseMessage)
                    .toList();
            log.debug("Failed to parse {}: {} problems", fileName, problems.size());
            return ParsingResult.failure(problems.isEmpty() ? List.of("Unknown parse error") : problems);
        }

        CompilationUnit cu = result.getResult().get();
        List<SyntaxNode> body = new ArrayList<>();
        cu.getTypes().forEach(td -> body.add(mapType(td)));
        return ParsingResult.success(new ModuleNode(fileName, body));
    }

    @Override
    public boolean supports(Path file) {
        return file.toString().endsWith(".java");
    }

    private ClassDef mapType(TypeDeclaration<?> td) {
        List<SyntaxNode> members = new ArrayList<>();
        if (td instanceof EnumDeclaration ed) {
            ed.getEntries().forEach(entry -> mapEnumConstant(entry).ifPresent(members::add));
        }
        td.getMembers().forEach(member -> mapMember(member, members));
        return new ClassDef(td.getNameAsString(), line(td), column(td), members);
    }

    private Optional<ClassDef> mapEnumConstant(EnumConstantDeclaration entry) {
        if (entry.getClassBody().isEmpty()) {
            return Optional.empty();
        }
        List<SyntaxNode> members = new ArrayList<>();
        entry.getClassBody().forEach(member -> mapMember(member, members));
        return Optional.of(new ClassDef(entry.getNameAsString(), line(entry), column(entry), members));
    }

    private void mapMember(BodyDeclaration<?> member, List<SyntaxNode> out) {
        if (member instanceof MethodDeclaration md) {
            // body-less methods have no control flow
            md.getBody().ifPresent(body -> out.add(function(md, body)));
        } else if (member instanceof ConstructorDeclaration cd) {
            out.add(function(cd, cd.getBody()));
        } else if (member instanceof CompactConstructorDeclaration ccd) {
            out.add(new FunctionDef(ccd.getNameAsString(), line(ccd), column(ccd), statements(ccd.getBody())));
        } else if (member instanceof InitializerDeclaration init) {
            out.addAll(statements(init.getBody()));
        } else if (member instanceof TypeDeclaration<?> nested) {
            out.add(mapType(nested));
        } else if (member instanceof FieldDeclaration fd) {
            out.add(simple(fd));
        }
    }

    private FunctionDef function(CallableDeclaration<?> callable, BlockStmt body) {
        return new FunctionDef(callable.getNameAsString(), line(callable), column(callable), statements(body));
    }

    private List<SyntaxNode> statements(Statement statement) {
        List<SyntaxNode> out = new ArrayList<>();
        mapStatement(statement, out);
        return out;
    }

    private void mapStatement(Statement s, List<SyntaxNode> out) {
        if (s instanceof BlockStmt block) {
            block.getStatements().forEach(child -> mapStatement(child, out));
        } else if (s instanceof IfStmt is) {
            List<SyntaxNode> orelse = is.getElseStmt()
                    .map(this::statements)
                    .orElse(List.of());
            out.add(new IfBranch(line(is), column(is), statements(is.getThenStmt()), orelse));
        } else if (s instanceof ForStmt fs) {
            out.add(new ForLoop(line(fs), column(fs), statements(fs.getBody())));
        } else if (s instanceof ForEachStmt fes) {
            out.add(new ForLoop(line(fes), column(fes), statements(fes.getBody())));
        } else if (s instanceof WhileStmt ws) {
            out.add(new WhileLoop(line(ws), column(ws), statements(ws.getBody())));
        } else if (s instanceof DoStmt ds) {
            out.add(new WhileLoop(line(ds), column(ds), statements(ds.getBody())));
        } else if (s instanceof TryStmt ts) {
            out.add(new WithBlock(line(ts), column(ts), statements(ts.getTryBlock())));
            for (CatchClause clause : ts.getCatchClauses()) {
                out.add(new WithBlock(line(clause), column(clause), statements(clause.getBody())));
            }
            ts.getFinallyBlock().ifPresent(fin -> mapStatement(fin, out));
        } else if (s instanceof SynchronizedStmt ss) {
            out.add(new WithBlock(line(ss), column(ss), statements(ss.getBody())));
        } else if (s instanceof SwitchStmt sw) {
            out.add(simple(sw));
            for (SwitchEntry entry : sw.getEntries()) {
                if (entry.getStatements().isEmpty()) {
                    continue;
                }
                List<SyntaxNode> body = new ArrayList<>();
                entry.getStatements().forEach(stmt -> mapStatement(stmt, body));
                out.add(new WithBlock(line(entry), column(entry), body));
            }
        } else if (s instanceof LabeledStmt ls) {
            mapStatement(ls.getStatement(), out);
        } else if (s instanceof LocalClassDeclarationStmt lcd) {
            out.add(mapType(lcd.getClassDeclaration()));
        } else if (s instanceof LocalRecordDeclarationStmt lrd) {
            out.add(mapType(lrd.getRecordDeclaration()));
        } else {
            out.add(simple(s));
        }
    }

    private SimpleStatement simple(Node node) {
        return new SimpleStatement(node.getClass().getSimpleName(), line(node), column(node));
    }

    private static Integer line(Node node) {
        return node.getBegin().map(p -> p.line).orElse(null);
    }

    private static int column(Node node) {
        return node.getBegin().map(p -> p.column).orElse(0);
    }
}
