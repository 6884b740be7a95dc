package com.bank.recovery.service;

import com.bank.recovery.exception.RequestValidationException;
import com.bank.recovery.model.Account;
import com.bank.recovery.model.Conversation;
import com.bank.recovery.model.ConversationDetail;
import com.bank.recovery.model.Debtor;
import com.bank.recovery.repository.AccountRepository;
import com.bank.recovery.repository.ConversationRepository;
import com.bank.recovery.repository.DebtorRepository;
import org.springframework.stereotype.Service;

import java.util.List;

@Service
public class ConversationQueryService {

    private final ConversationRepository conversationRepository;
    private final DebtorRepository debtorRepository;
    private final AccountRepository accountRepository;

    public ConversationQueryService(ConversationRepository conversationRepository,
                                    DebtorRepository debtorRepository,
                                    AccountRepository accountRepository) {
        this.conversationRepository = conversationRepository;
        this.debtorRepository = debtorRepository;
        this.accountRepository = accountRepository;
    }

    public ConversationDetail getConversation(String conversationId) {
        Conversation conversation = conversationRepository.findById(conversationId);
        if (conversation == null) {
            throw RequestValidationException.notFound("Conversation", conversationId);
        }
        Debtor debtor = debtorRepository.findById(conversation.getDebtorId());
        Account account = accountRepository.findById(conversation.getAccountId());
        return new ConversationDetail(
                conversation,
                debtor != null ? debtor.getName() : null,
                debtor != null ? debtor.getPreferredChannel() : null,
                debtor != null && debtor.isOptedOut(),
                account != null ? account.getAccountNumber() : null,
                account != null ? account.getCurrentBalance() : 0.0,
                account != null ? account.getDaysOverdue() : 0);
    }

    public List<Conversation> getAccountConversations(String accountId) {
        if (accountRepository.findById(accountId) == null) {
            throw RequestValidationException.notFound("Account", accountId);
        }
        return conversationRepository.findByAccountId(accountId);
    }
}
