package com.lambdacalc.compiler.parser;

import com.lambdacalc.compiler.ast.Abstraction;
import com.lambdacalc.compiler.ast.Application;
import com.lambdacalc.compiler.ast.ChurchNumerals;
import com.lambdacalc.compiler.ast.Term;
import com.lambdacalc.compiler.ast.Variable;
import com.lambdacalc.compiler.lexer.Lexer;
import com.lambdacalc.compiler.lexer.Token;
import com.lambdacalc.compiler.lexer.TokenType;

import static com.lambdacalc.compiler.lexer.TokenType.*;

/**
 * λ 演算语法分析器（递归下降）
 *
 * <pre>
 * expr := 'λ' NAME '.' expr | app
 * app  := atom atom* ('λ' NAME '.' expr)?
 * atom := '(' expr ')' | NUMBER | NAME
 * </pre>
 *
 * <p>应用左结合；抽象体尽可能向右延伸。数字字面量直接编码为 Church 数。</p>
 */
public class Parser {

    final Lexer lexer;
    final String fileName;
    Token current;
    Token previous;

    public Parser(Lexer lexer, String fileName) {
        this.lexer = lexer;
        this.fileName = fileName;
        advance();  // 读取第一个 token
    }

    public Parser(Lexer lexer) {
        this(lexer, lexer.getFileName());
    }

    /**
     * 解析源码为 λ 项
     *
     * @throws ParseException 语法错误
     */
    public static Term parse(String source) {
        return new Parser(new Lexer(source)).parse();
    }

    /**
     * 解析完整输入，末尾不允许多余 token
     */
    public Term parse() {
        Term term = parseExpression();
        if (!check(EOF)) {
            throw error("Unexpected input after expression", "end of input");
        }
        return term;
    }

    // ============ 语法规则 ============

    Term parseExpression() {
        if (check(LAMBDA)) {
            return parseAbstraction();
        }
        return parseApplication();
    }

    Abstraction parseAbstraction() {
        consume(LAMBDA, "'λ'");
        Token name = consume(IDENTIFIER, "parameter name after 'λ'");
        consume(DOT, "'.' after λ parameter");
        Term body = parseExpression();
        return new Abstraction(name.getLexeme(), body);
    }

    Term parseApplication() {
        Term result = parseAtom();
        while (true) {
            if (check(LAMBDA)) {
                // 末尾参数可以是不加括号的抽象：f λx.x
                return new Application(result, parseAbstraction());
            }
            if (!startsAtom()) {
                return result;
            }
            result = new Application(result, parseAtom());
        }
    }

    Term parseAtom() {
        if (match(LPAREN)) {
            Term inner = parseExpression();
            consume(RPAREN, "')'");
            return inner;
        }
        if (check(NUMBER)) {
            Token number = advance();
            return ChurchNumerals.encode((Integer) number.getLiteral());
        }
        if (check(IDENTIFIER)) {
            return new Variable(advance().getLexeme());
        }
        if (check(ERROR)) {
            throw new ParseException((String) current.getLiteral(), current);
        }
        throw error("Expected expression", "variable, number, 'λ' or '('");
    }

    // ============ 基础方法 ============

    Token advance() {
        previous = current;
        current = lexer.nextToken();
        return previous;
    }

    boolean check(TokenType type) {
        return current.getType() == type;
    }

    boolean match(TokenType type) {
        if (check(type)) {
            advance();
            return true;
        }
        return false;
    }

    Token consume(TokenType type, String expected) {
        if (check(type)) {
            return advance();
        }
        if (check(ERROR)) {
            throw new ParseException((String) current.getLiteral(), current, expected);
        }
        throw error("Unexpected token", expected);
    }

    private boolean startsAtom() {
        return current.isOneOf(LPAREN, NUMBER, IDENTIFIER, ERROR);
    }

    private ParseException error(String message, String expected) {
        return new ParseException(message, current, expected);
    }
}
