/**
 * 预置监听器
 */
package xyz.firestige.retry.listener;
