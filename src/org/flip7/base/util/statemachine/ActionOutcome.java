package org.flip7.base.util.statemachine;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.flip7.base.util.cards.Card;

/**
 * Record of everything that happened when one action was applied to a {@link GameState}.
 */
public class ActionOutcome
{
  private final Action           mAction;
  private final int              mPlayer;
  private final List<Card>       mCardsDrawn = new ArrayList<>();
  private final List<TurnEffect> mEffects    = new ArrayList<>();
  private boolean                mTurnEnded  = false;
  private boolean                mRoundEnded = false;
  private boolean                mGameOver   = false;
  private int                    mBankedScore = 0;
  private TurnState              mFinalTurn  = null;

  ActionOutcome(Action xiAction, int xiPlayer)
  {
    mAction = xiAction;
    mPlayer = xiPlayer;
  }

  void noteDraw(Card xiCard, TurnEffect xiEffect)
  {
    mCardsDrawn.add(xiCard);
    mEffects.add(xiEffect);
  }

  void noteEffect(TurnEffect xiEffect)
  {
    mEffects.add(xiEffect);
  }

  void noteTurnEnd(TurnState xiFinalTurn, int xiBankedScore)
  {
    mTurnEnded = true;
    mFinalTurn = xiFinalTurn;
    mBankedScore = xiBankedScore;
  }

  void noteRoundEnd(boolean xiGameOver)
  {
    mRoundEnded = true;
    mGameOver = xiGameOver;
  }

  public Action getAction()
  {
    return mAction;
  }

  /**
   * @return the seat of the player who acted.
   */
  public int getPlayer()
  {
    return mPlayer;
  }

  /**
   * @return every card drawn, including forced draws, in order.
   */
  public List<Card> getCardsDrawn()
  {
    return Collections.unmodifiableList(mCardsDrawn);
  }

  public List<TurnEffect> getEffects()
  {
    return Collections.unmodifiableList(mEffects);
  }

  public boolean isTurnEnded()
  {
    return mTurnEnded;
  }

  public boolean isRoundEnded()
  {
    return mRoundEnded;
  }

  public boolean isGameOver()
  {
    return mGameOver;
  }

  /**
   * @return the points added to the player's total - zero unless the turn ended.
   */
  public int getBankedScore()
  {
    return mBankedScore;
  }

  /**
   * @return the player's turn state at the moment the turn ended, or null if it is still going.
   */
  public TurnState getFinalTurn()
  {
    return mFinalTurn;
  }

  public boolean isBust()
  {
    return mTurnEnded && mFinalTurn.getStatus() == TurnStatus.BUSTED;
  }

  public boolean isFlip7()
  {
    return mTurnEnded && mFinalTurn.getStatus() != TurnStatus.BUSTED && mFinalTurn.hasFlip7();
  }

  @Override
  public String toString()
  {
    return "ActionOutcome(" + mAction + " by " + mPlayer + ": drew " + mCardsDrawn + ", effects " + mEffects +
           (mTurnEnded ? ", banked " + mBankedScore : "") + ")";
  }
}
