package org.javai.bali.tree;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

import org.javai.bali.BdnParser;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class BdnNodeWalkerTest {

	private final BdnParser parser = new BdnParser();

	@Mock
	private BdnNodeVisitor<Void> visitor;

	@Test
	void preOrderVisitsParentBeforeChildren() {
		Tree sum = (Tree) parser.parseExpression("a + 1");

		BdnNodeWalker.walkPreOrder(sum, visitor);

		InOrder order = inOrder(visitor);
		order.verify(visitor).visitTree(sum);
		order.verify(visitor).visitTerminal(new Terminal(NodeType.VARIABLE, "a"));
		order.verify(visitor).visitTerminal(new Terminal(NodeType.NUMBER, "1"));
	}

	@Test
	void postOrderVisitsChildrenBeforeParent() {
		Tree sum = (Tree) parser.parseExpression("a + 1");

		BdnNodeWalker.walkPostOrder(sum, visitor);

		InOrder order = inOrder(visitor);
		order.verify(visitor).visitTerminal(new Terminal(NodeType.VARIABLE, "a"));
		order.verify(visitor).visitTerminal(new Terminal(NodeType.NUMBER, "1"));
		order.verify(visitor).visitTree(sum);
	}

	@Test
	void everyNodeIsVisitedOnce() {
		BdnNode document = parser.parseDocument("[1, [2, 3]]");

		BdnNodeWalker.walkPreOrder(document, visitor);

		verify(visitor, times(3)).visitTerminal(any());
		verify(visitor, times(4)).visitTree(any());
	}

	@Test
	void walkingNullReturnsNull() {
		assertThat(BdnNodeWalker.walkPreOrder(null, new CountingVisitor())).isNull();
	}

	@Test
	void collectFindsMatchingNodes() {
		BdnNode statement = parser.parseStatement("if $a > 1 then {return $b} else {return $c}");

		assertThat(BdnNodeWalker.collect(statement, node -> node.type() == NodeType.SYMBOL))
				.extracting(node -> ((Terminal) node).value())
				.containsExactly("$a", "$b", "$c");
		assertThat(BdnNodeWalker.contains(statement, NodeType.RETURN_CLAUSE)).isTrue();
		assertThat(BdnNodeWalker.contains(statement, NodeType.WHILE_CLAUSE)).isFalse();
	}

	private static final class CountingVisitor implements BdnNodeVisitor<Integer> {
		private int count;

		@Override
		public Integer visitTerminal(Terminal terminal) {
			return ++count;
		}

		@Override
		public Integer visitTree(Tree tree) {
			return ++count;
		}
	}
}
