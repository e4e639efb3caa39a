package com.dynamoexpr.parser.parselet;

import com.dynamoexpr.ast.CallExpression;
import com.dynamoexpr.ast.Expression;
import com.dynamoexpr.parser.ExpressionParser;
import com.dynamoexpr.parser.InfixParselet;
import com.dynamoexpr.parser.Precedence;
import com.dynamoexpr.token.Token;
import com.dynamoexpr.token.TokenType;

import java.util.ArrayList;
import java.util.List;

/**
 * Function call: the expression before {@code (} is the callee, followed by a
 * comma-separated argument list.
 */
public class CallParselet implements InfixParselet {

    @Override
    public Expression parse(ExpressionParser parser, Expression callee) {
        Token paren = parser.current();

        List<Expression> arguments = parseArguments(parser);
        if (arguments == null) {
            return null;
        }
        return new CallExpression(paren, callee, arguments);
    }

    private List<Expression> parseArguments(ExpressionParser parser) {
        List<Expression> arguments = new ArrayList<>();

        if (parser.lookaheadIs(TokenType.RPAREN)) {
            parser.advance();
            return arguments;
        }

        parser.advance();
        arguments.add(parser.parseExpression(Precedence.LOWEST));

        while (parser.lookaheadIs(TokenType.COMMA)) {
            parser.advance();
            parser.advance();
            arguments.add(parser.parseExpression(Precedence.LOWEST));
        }

        if (!parser.expectLookahead(TokenType.RPAREN)) {
            return null;
        }
        return arguments;
    }
}
