package org.cinder.codegen;

import org.cinder.frontend.Expression;
import org.cinder.frontend.LineTokenizer;
import org.cinder.frontend.SourceLine;
import org.cinder.semantic.SymbolTable;
import org.cinder.semantic.type.ValueType;
import org.cinder.util.ErrorHandler;
import org.junit.Before;
import org.junit.Test;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;

public class ExpressionRewriterTest
{
	private SymbolTable symbols;
	private ExpressionRewriter rewriter;

	@Before
	public void setUp()
	{
		symbols = new SymbolTable(16);
		rewriter = new ExpressionRewriter(symbols);
	}

	private String rewrite(String text)
	{
		SourceLine line = new SourceLine(1, 0, text);
		return rewriter.rewrite(Expression.of(text, new LineTokenizer(new ErrorHandler()).tokenize(line)));
	}

	@Test
	public void listIndexingReadsTheStorage()
	{
		symbols.register("xs", ValueType.LIST, false);
		symbols.register("pair", ValueType.TUPLE, false);

		assertThat(rewrite("xs[0] + xs[i]"), is("xs.data[0] + xs.data[i]"));
		assertThat(rewrite("pair[1]"), is("pair.data[1]"));
	}

	@Test
	public void otherIndexingIsLeftAlone()
	{
		symbols.register("s", ValueType.STRING, false);

		assertThat(rewrite("s[0]"), is("s[0]"));
		assertThat(rewrite("raw[0]"), is("raw[0]"));
	}

	@Test
	public void memberWithListNameIsLeftAlone()
	{
		symbols.register("xs", ValueType.LIST, false);

		assertThat(rewrite("point.xs[0]"), is("point.xs[0]"));
		assertThat(rewrite("xs.size"), is("xs.size"));
	}

	@Test
	public void timeCallsAreReplaced()
	{
		assertThat(rewrite("time.now()"), is("(int)time(NULL)"));
		assertThat(rewrite("date.now() - start"), is("(int)time(NULL) - start"));
		assertThat(rewrite("clock.now() * 1000"), is("((double)clock()/CLOCKS_PER_SEC) * 1000"));
	}

	@Test
	public void stringLiteralsAreNeverRewritten()
	{
		symbols.register("xs", ValueType.LIST, false);

		assertThat(rewrite("\"time.now() xs[0]\""), is("\"time.now() xs[0]\""));
	}

	@Test
	public void spacingIsPreserved()
	{
		assertThat(rewrite("a  ==  b"), is("a  ==  b"));
	}

	@Test
	public void literalExpressionsPassThrough()
	{
		assertThat(rewriter.rewrite(Expression.literal("1")), is("1"));
	}
}
