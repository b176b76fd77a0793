package org.flip7.base.util.cards;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Random;

import org.flip7.base.util.statemachine.exceptions.EmptyDeckException;
import org.junit.Assert;
import org.junit.Test;

import com.google.common.collect.HashMultiset;
import com.google.common.collect.ImmutableMultiset;

public class DeckTest extends Assert
{
  @Test
  public void testNewDeckComposition()
  {
    Deck lDeck = Deck.newDeck();
    assertEquals(94, lDeck.size());
    assertEquals(Deck.FULL_SIZE, lDeck.size());

    ImmutableMultiset<Card> lComposition = Deck.composition();
    assertEquals(94, lComposition.size());
    assertEquals(1, lComposition.count(Card.number(0)));
    assertEquals(1, lComposition.count(Card.number(1)));
    for (int lValue = 2; lValue <= 12; lValue++)
    {
      assertEquals("Copies of " + lValue, lValue, lComposition.count(Card.number(lValue)));
    }
    for (int lValue = 2; lValue <= 10; lValue++)
    {
      assertEquals(1, lComposition.count(Card.modifier(lValue)));
    }
    assertEquals(2, lComposition.count(Card.action(ActionType.FREEZE)));
    assertEquals(2, lComposition.count(Card.action(ActionType.FLIP_THREE)));
    assertEquals(1, lComposition.count(Card.action(ActionType.SECOND_CHANCE)));
    assertEquals(1, lComposition.count(Card.multiplier()));

    assertEquals(lComposition, HashMultiset.create(lDeck.getCards()));
  }

  @Test
  public void testShufflePreservesCards()
  {
    Deck lShuffled = Deck.shuffle(Deck.newDeck(), new Random(42));
    assertEquals(Deck.composition(), HashMultiset.create(lShuffled.getCards()));
    assertNotEquals(Deck.newDeck().getCards(), lShuffled.getCards());
  }

  @Test
  public void testShuffleDependsOnlyOnSeed()
  {
    Deck lFirst = Deck.shuffle(Deck.newDeck(), new Random(7));
    Deck lSecond = Deck.shuffle(Deck.newDeck(), new Random(7));
    Deck lOther = Deck.shuffle(Deck.newDeck(), new Random(8));

    assertEquals(lFirst.getCards(), lSecond.getCards());
    assertNotEquals(lFirst.getCards(), lOther.getCards());
  }

  @Test
  public void testShuffleLeavesInputAlone() throws Exception
  {
    Deck lDeck = new Deck(Arrays.asList(Card.number(1), Card.number(2), Card.number(3), Card.number(4)));
    lDeck.draw();
    List<Card> lBefore = lDeck.getCards();

    Deck lShuffled = Deck.shuffle(lDeck, new Random(1));

    assertEquals(lBefore, lDeck.getCards());
    assertEquals(3, lShuffled.size());
    assertFalse(lShuffled.getCards().contains(Card.number(1)));
  }

  @Test
  public void testDrawFromFront() throws Exception
  {
    Deck lDeck = new Deck(Arrays.asList(Card.number(5), Card.multiplier()));
    assertEquals(Card.number(5), lDeck.peek());
    assertEquals(Card.number(5), lDeck.draw());
    assertEquals(Card.multiplier(), lDeck.draw());
    assertTrue(lDeck.isEmpty());
    assertNull(lDeck.peek());
  }

  @Test(expected = EmptyDeckException.class)
  public void testDrawFromEmptyDeck() throws Exception
  {
    new Deck(new ArrayList<Card>()).draw();
  }

  @Test
  public void testCopyIsIndependent() throws Exception
  {
    Deck lDeck = Deck.newDeck();
    Deck lCopy = lDeck.copy();
    lCopy.draw();
    lCopy.draw();

    assertEquals(94, lDeck.size());
    assertEquals(92, lCopy.size());
    assertEquals(lDeck.getCards().subList(2, 94), lCopy.getCards());
  }

  @Test
  public void testCardValues()
  {
    assertEquals(CardKind.NUMBER, Card.number(12).getKind());
    assertEquals(12, Card.number(12).getValue());
    assertEquals(CardKind.MODIFIER, Card.modifier(4).getKind());
    assertEquals(ActionType.FREEZE, Card.action(ActionType.FREEZE).getActionType());
    assertNull(Card.number(3).getActionType());
    assertEquals("N3", Card.number(3).toString());
    assertEquals("+10", Card.modifier(10).toString());
    assertEquals("x2", Card.multiplier().toString());
  }

  @Test(expected = IllegalArgumentException.class)
  public void testNoThirteen()
  {
    Card.number(13);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testNoPlusOne()
  {
    Card.modifier(1);
  }
}
